package com.flagship.number_gateway.provider;

import com.flagship.number_gateway.dispatch.AbandonedReplyHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Releases numbers the provider leased after the purchasing caller had already timed out.
 *
 * Such a lease is billed by the provider but was never recorded in the ledger, so it is cancelled
 * with setStatus(8) instead of being left to run out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseReleaseHandler implements AbandonedReplyHandler {

    private final ProviderResponseCodec codec;

    @Override
    public Optional<ProviderRequest> compensationFor(ProviderRequest request, ProviderReply reply) {
        if (request.getAction() != ProviderAction.GET_NUMBER) {
            return Optional.empty();
        }
        ActivationLease lease;
        try {
            lease = codec.parseLease(reply.getBody());
        } catch (ProviderException e) {
            log.error("RECONCILIATION_REQUIRED: unreadable late getNumber reply, cannot release: body={}",
                reply.getBody());
            return Optional.empty();
        }
        log.error("RECONCILIATION_REQUIRED: number leased after the purchase timed out, releasing: activationId={}, phone={}",
            lease.getActivationId(), lease.getPhoneNumber());
        return Optional.of(ProviderRequest.of(ProviderAction.SET_STATUS,
            ProviderRequest.params()
                .put("id", lease.getActivationId())
                .put("status", ActivationAction.CANCEL.getCode())
                .build()));
    }
}
