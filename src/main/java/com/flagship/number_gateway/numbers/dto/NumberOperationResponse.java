package com.flagship.number_gateway.numbers.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.numbers.PurchaseOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of purchase, cancel, complete and retry.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NumberOperationResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("message")
    String message;

    @JsonProperty("number")
    NumberResponse number;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    public static NumberOperationResponse from(PurchaseOutcome outcome, String message) {
        return NumberOperationResponse.builder()
            .success(true)
            .message(message)
            .number(NumberResponse.from(outcome.getPurchase()))
            .refundedAmount(outcome.getPurchase().getRefundedAmount())
            .newBalance(outcome.getBalanceAfter())
            .build();
    }
}
