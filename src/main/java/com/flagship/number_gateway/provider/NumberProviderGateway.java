package com.flagship.number_gateway.provider;

import com.flagship.number_gateway.dispatch.RateLimitedDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Typed operations against the number provider. Every call is paced by the {@link RateLimitedDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NumberProviderGateway {

    private final RateLimitedDispatcher dispatcher;
    private final ProviderResponseCodec codec;

    public BigDecimal getProviderBalance() {
        ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_BALANCE));
        return codec.parseBalance(reply.getBody());
    }

    public BigDecimal getPrice(String service, String country) {
        ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_PRICES,
            ProviderRequest.params().put("service", service).put("country", country).build()));
        return codec.parsePrice(reply.getBody(), country, service);
    }

    public ActivationLease leaseNumber(String service, String country, String operator, BigDecimal maxPrice) {
        ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_NUMBER,
            ProviderRequest.params()
                .put("service", service)
                .put("country", country)
                .put("operator", operator)
                .put("maxPrice", maxPrice == null ? null : maxPrice.toPlainString())
                .build()));
        ActivationLease lease = codec.parseLease(reply.getBody());
        log.info("Leased number: activationId={}, service={}, country={}", lease.getActivationId(), service, country);
        return lease;
    }

    public String setStatus(String activationId, ActivationAction action) {
        ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.SET_STATUS,
            ProviderRequest.params().put("id", activationId).put("status", action.getCode()).build()));
        return codec.parseSetStatus(reply.getBody());
    }

    public ActivationStatus getStatus(String activationId) {
        ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS,
            ProviderRequest.params().put("id", activationId).build()));
        return codec.parseStatus(reply.getBody());
    }

    public String getFullSms(String activationId) {
        ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_FULL_SMS,
            ProviderRequest.params().put("id", activationId).build()));
        return codec.parseFullSms(reply.getBody());
    }
}
