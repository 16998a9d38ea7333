package com.flagship.number_gateway.provider;

import lombok.Getter;

/**
 * Codes accepted by the provider's setStatus action.
 */
@Getter
public enum ActivationAction {
    CONFIRM_SMS(1),
    REQUEST_RETRY(3),
    FINISH(6),
    CANCEL(8);

    private final int code;

    ActivationAction(int code) {
        this.code = code;
    }
}
