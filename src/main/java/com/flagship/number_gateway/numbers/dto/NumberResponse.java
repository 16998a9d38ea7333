package com.flagship.number_gateway.numbers.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.numbers.NumberPurchase;
import com.flagship.number_gateway.numbers.NumberStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class NumberResponse {

    @JsonProperty("activation_id")
    String activationId;

    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("country")
    String country;

    @JsonProperty("service")
    String service;

    @JsonProperty("operator")
    String operator;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("status")
    NumberStatus status;

    @JsonProperty("sms_code")
    String smsCode;

    @JsonProperty("sms_text")
    String smsText;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("purchased_at")
    Instant purchasedAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("received_at")
    Instant receivedAt;

    public static NumberResponse from(NumberPurchase purchase) {
        return NumberResponse.builder()
            .activationId(purchase.getActivationId())
            .phoneNumber(purchase.getPhoneNumber())
            .country(purchase.getCountryCode())
            .service(purchase.getServiceCode())
            .operator(purchase.getOperator())
            .price(purchase.getPrice())
            .status(purchase.getStatus())
            .smsCode(purchase.getSmsCode())
            .smsText(purchase.getSmsText())
            .refundedAmount(purchase.getRefundedAmount())
            .purchasedAt(purchase.getPurchasedAt())
            .expiresAt(purchase.getExpiresAt())
            .receivedAt(purchase.getReceivedAt())
            .build();
    }
}
