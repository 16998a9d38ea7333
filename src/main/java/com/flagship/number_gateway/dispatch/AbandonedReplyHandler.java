package com.flagship.number_gateway.dispatch;

import com.flagship.number_gateway.provider.ProviderReply;
import com.flagship.number_gateway.provider.ProviderRequest;

import java.util.Optional;

/**
 * Decides what to do with a successful reply whose caller already timed out.
 */
@FunctionalInterface
public interface AbandonedReplyHandler {

    AbandonedReplyHandler NONE = (request, reply) -> Optional.empty();

    /**
     * @return a request that undoes the provider-side effect of {@code reply}, if it left one
     */
    Optional<ProviderRequest> compensationFor(ProviderRequest request, ProviderReply reply);
}
