package com.flagship.number_gateway.provider;

import java.time.Duration;

/**
 * Single-attempt call to the number-provisioning provider.
 *
 * Implementations never retry and never sleep: pacing and retries belong to the dispatcher.
 *
 * @see com.flagship.number_gateway.dispatch.RateLimitedDispatcher
 */
public interface ProviderClient {

    /**
     * Executes one request.
     *
     * @param request the action and parameters to send
     * @return the screened success reply
     * @throws ProviderException with a decoded kind for any provider or transport failure
     */
    ProviderReply execute(ProviderRequest request);

    /**
     * Executes one request that must finish within {@code budget}.
     *
     * The default ignores the budget; transports with their own timeouts should cap them to it.
     */
    default ProviderReply execute(ProviderRequest request, Duration budget) {
        return execute(request);
    }
}
