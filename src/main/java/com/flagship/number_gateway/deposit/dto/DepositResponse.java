package com.flagship.number_gateway.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.deposit.DepositStatus;
import com.flagship.number_gateway.deposit.PaymentDeposit;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("tx_ref")
    String txRef;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("settlement_equivalent")
    BigDecimal settlementEquivalent;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("settled_amount")
    BigDecimal settledAmount;

    @JsonProperty("status")
    DepositStatus status;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("payment_link")
    String paymentLink;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static DepositResponse from(PaymentDeposit deposit) {
        return DepositResponse.builder()
            .txRef(deposit.getTxRef())
            .amount(deposit.getAmount())
            .currency(deposit.getCurrency())
            .settlementEquivalent(deposit.getSettlementEquivalent())
            .exchangeRate(deposit.getExchangeRate())
            .settledAmount(deposit.getSettledAmount())
            .status(deposit.getStatus())
            .failureReason(deposit.getFailureReason())
            .paymentLink(deposit.getPaymentLink())
            .expiresAt(deposit.getExpiresAt())
            .paidAt(deposit.getPaidAt())
            .createdAt(deposit.getCreatedAt())
            .build();
    }
}
