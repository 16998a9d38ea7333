package com.flagship.number_gateway.numbers;

/**
 * Lifecycle of a leased number.
 */
public enum NumberStatus {
    /**
     * Leased and waiting for an SMS. Initial state.
     */
    WAITING,

    /**
     * At least one code has arrived. Newer codes replace older ones.
     */
    RECEIVED,

    /**
     * Cancelled by the user or by the provider. Terminal.
     */
    CANCELLED,

    /**
     * The lease ran out before a code arrived. Terminal.
     */
    EXPIRED,

    /**
     * Completed after a code was received. Terminal.
     */
    USED;

    public boolean isTerminal() {
        return this == CANCELLED || this == EXPIRED || this == USED;
    }

    public boolean isActive() {
        return this == WAITING || this == RECEIVED;
    }
}
