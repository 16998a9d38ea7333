package com.flagship.number_gateway.provider;

import lombok.Getter;

import java.time.Duration;

/**
 * Decoded provider failure. The dispatcher retries {@link ProviderErrorKind#RATE_LIMITED} internally;
 * every other kind is returned to the caller as-is.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final ProviderErrorKind kind;
    private final ProviderErrorCode code;
    private final Duration retryAfter;

    public ProviderException(ProviderErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ProviderException(ProviderErrorCode code, String message, Duration retryAfter) {
        this(code, message, retryAfter, null);
    }

    public ProviderException(ProviderErrorCode code, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = code.getKind();
        this.code = code;
        this.retryAfter = retryAfter;
    }

    /**
     * Failure produced by the dispatcher itself rather than decoded from a provider response.
     */
    public static ProviderException ofKind(ProviderErrorKind kind, String message) {
        ProviderErrorCode code = switch (kind) {
            case RATE_LIMITED -> ProviderErrorCode.TOO_MANY_REQUESTS;
            case TIMEOUT -> ProviderErrorCode.TRANSPORT_TIMEOUT;
            default -> ProviderErrorCode.UNKNOWN;
        };
        return new ProviderException(code, message);
    }

    public boolean isRateLimited() {
        return kind == ProviderErrorKind.RATE_LIMITED;
    }
}
