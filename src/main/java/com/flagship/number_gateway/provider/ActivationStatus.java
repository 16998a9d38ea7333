package com.flagship.number_gateway.provider;

import lombok.Value;

/**
 * Provider view of an activation, decoded from a STATUS_* reply.
 */
@Value
public class ActivationStatus {

    public enum State {
        WAIT_CODE,
        WAIT_RETRY,
        WAIT_RESEND,
        OK,
        CANCEL,
        UNKNOWN
    }

    State state;
    String code;

    public boolean hasCode() {
        return state == State.OK && code != null && !code.isBlank();
    }

    public boolean isCancelled() {
        return state == State.CANCEL;
    }
}
