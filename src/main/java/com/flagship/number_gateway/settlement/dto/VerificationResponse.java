package com.flagship.number_gateway.settlement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.settlement.SettlementOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResponse {

    @JsonProperty("tx_ref")
    String txRef;

    @JsonProperty("status")
    String status;

    @JsonProperty("already_processed")
    boolean alreadyProcessed;

    @JsonProperty("amount_credited")
    BigDecimal amountCredited;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    public static VerificationResponse from(SettlementOutcome outcome) {
        return VerificationResponse.builder()
            .txRef(outcome.getTxRef())
            .status("PAID_SETTLED")
            .alreadyProcessed(outcome.isAlreadyProcessed())
            .amountCredited(outcome.getAmountCredited())
            .newBalance(outcome.getBalanceAfter())
            .build();
    }
}
