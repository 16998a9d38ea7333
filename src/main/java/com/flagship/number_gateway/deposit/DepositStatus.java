package com.flagship.number_gateway.deposit;

/**
 * Lifecycle of a deposit session. Only PENDING_UNSETTLED moves, and only once.
 */
public enum DepositStatus {
    PENDING_UNSETTLED,
    PAID_SETTLED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING_UNSETTLED;
    }
}
