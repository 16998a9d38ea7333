package com.flagship.number_gateway.provider;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every error token the provider is known to return, decoded once at the client boundary.
 *
 * Synthetic codes ({@link #HTTP_429}, {@link #TRANSPORT_TIMEOUT}, {@link #TRANSPORT_FAILURE},
 * {@link #UNEXPECTED_RESPONSE}, {@link #UNKNOWN}) cover failures that carry no provider token.
 */
@Getter
public enum ProviderErrorCode {
    BAD_KEY(ProviderErrorKind.INVALID_REQUEST),
    BAD_ACTION(ProviderErrorKind.INVALID_REQUEST),
    BAD_SERVICE(ProviderErrorKind.INVALID_REQUEST),
    BAD_STATUS(ProviderErrorKind.INVALID_REQUEST),
    WRONG_ACTIVATION_ID(ProviderErrorKind.INVALID_REQUEST),
    WRONG_EXCEPTION_PHONE(ProviderErrorKind.INVALID_REQUEST),
    WRONG_ADDITIONAL_SERVICE(ProviderErrorKind.INVALID_REQUEST),
    NO_ACTIVATION(ProviderErrorKind.INVALID_REQUEST),
    ACTIVATION_USED(ProviderErrorKind.INVALID_REQUEST),
    NO_OPERATIONS(ProviderErrorKind.INVALID_REQUEST),
    NO_NUMBERS(ProviderErrorKind.NO_INVENTORY),
    NO_BALANCE(ProviderErrorKind.INSUFFICIENT_PROVIDER_FUNDS),
    TOO_MANY_REQUESTS(ProviderErrorKind.RATE_LIMITED),
    ERROR_SQL(ProviderErrorKind.UPSTREAM),

    HTTP_429(ProviderErrorKind.RATE_LIMITED),
    TRANSPORT_TIMEOUT(ProviderErrorKind.TIMEOUT),
    TRANSPORT_FAILURE(ProviderErrorKind.UPSTREAM),
    UNEXPECTED_RESPONSE(ProviderErrorKind.UPSTREAM),
    UNKNOWN(ProviderErrorKind.UPSTREAM);

    private final ProviderErrorKind kind;

    ProviderErrorCode(ProviderErrorKind kind) {
        this.kind = kind;
    }

    /**
     * Resolves a response body to a known token. The token must be the whole body or be followed by ':'.
     */
    public static Optional<ProviderErrorCode> fromToken(String body) {
        if (body == null) {
            return Optional.empty();
        }
        String trimmed = body.trim();
        return Arrays.stream(values())
            .filter(code -> trimmed.equals(code.name()) || trimmed.startsWith(code.name() + ":"))
            .findFirst();
    }
}
