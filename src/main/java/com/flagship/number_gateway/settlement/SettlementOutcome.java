package com.flagship.number_gateway.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What one settlement attempt did. {@code ALREADY_PROCESSED} is a success, not an error.
 */
@Value
public class SettlementOutcome {

    public enum Result {
        SETTLED,
        ALREADY_PROCESSED,
        REJECTED,
        MARKED_FAILED,
        CANCELLED,
        IGNORED
    }

    Result result;
    String txRef;
    String userId;
    BigDecimal amountCredited;
    BigDecimal balanceAfter;
    String reason;

    public static SettlementOutcome settled(String txRef, String userId, BigDecimal credited, BigDecimal balanceAfter) {
        return new SettlementOutcome(Result.SETTLED, txRef, userId, credited, balanceAfter, null);
    }

    public static SettlementOutcome alreadyProcessed(String txRef, String userId) {
        return new SettlementOutcome(Result.ALREADY_PROCESSED, txRef, userId, null, null, null);
    }

    public static SettlementOutcome of(Result result, String txRef, String userId, String reason) {
        return new SettlementOutcome(result, txRef, userId, null, null, reason);
    }

    public boolean isAlreadyProcessed() {
        return result == Result.ALREADY_PROCESSED;
    }

    public boolean isSettled() {
        return result == Result.SETTLED;
    }
}
