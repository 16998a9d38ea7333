package com.flagship.number_gateway.provider;

/**
 * Coarse classification of provider failures. Only {@link #RATE_LIMITED} is retried by the dispatcher.
 */
public enum ProviderErrorKind {
    RATE_LIMITED,
    INVALID_REQUEST,
    NO_INVENTORY,
    INSUFFICIENT_PROVIDER_FUNDS,
    UPSTREAM,
    TIMEOUT
}
