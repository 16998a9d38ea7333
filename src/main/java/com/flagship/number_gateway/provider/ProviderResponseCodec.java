package com.flagship.number_gateway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Decodes provider response bodies.
 *
 * Error tokens are turned into {@link ProviderException} by {@link #screen}; the parse methods assume a
 * screened body and reject anything that does not match the expected success shape.
 */
@Component
@RequiredArgsConstructor
public class ProviderResponseCodec {

    private static final String ACCESS_NUMBER = "ACCESS_NUMBER:";
    private static final String ACCESS_BALANCE = "ACCESS_BALANCE:";
    private static final String FULL_SMS = "FULL_SMS:";
    private static final String STATUS_PREFIX = "STATUS_";
    private static final Set<String> SET_STATUS_REPLIES =
        Set.of("ACCESS_READY", "ACCESS_RETRY_GET", "ACCESS_ACTIVATION", "ACCESS_CANCEL");

    private final ObjectMapper objectMapper;

    /**
     * Throws for any known error token or ERROR* text, otherwise returns the trimmed body.
     */
    public String screen(ProviderAction action, String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderException(ProviderErrorCode.UNEXPECTED_RESPONSE,
                "Empty response for " + action.getWireName());
        }
        String trimmed = body.trim();
        var known = ProviderErrorCode.fromToken(trimmed);
        if (known.isPresent()) {
            throw new ProviderException(known.get(), "Provider returned " + trimmed + " for " + action.getWireName());
        }
        if (trimmed.startsWith("ERROR")) {
            throw new ProviderException(ProviderErrorCode.UNKNOWN, "Provider error: " + trimmed);
        }
        return trimmed;
    }

    public ActivationLease parseLease(String body) {
        if (body.startsWith(ACCESS_NUMBER)) {
            String[] parts = body.split(":", 3);
            if (parts.length == 3 && !parts[1].isBlank() && !parts[2].isBlank()) {
                return new ActivationLease(parts[1], parts[2]);
            }
        }
        throw unexpected("getNumber", body);
    }

    public ActivationStatus parseStatus(String body) {
        if (!body.startsWith(STATUS_PREFIX)) {
            throw unexpected("getStatus", body);
        }
        int colon = body.indexOf(':');
        String token = colon < 0 ? body : body.substring(0, colon);
        String code = colon < 0 ? null : body.substring(colon + 1);
        ActivationStatus.State state = switch (token) {
            case "STATUS_WAIT_CODE" -> ActivationStatus.State.WAIT_CODE;
            case "STATUS_WAIT_RETRY" -> ActivationStatus.State.WAIT_RETRY;
            case "STATUS_WAIT_RESEND" -> ActivationStatus.State.WAIT_RESEND;
            case "STATUS_OK" -> ActivationStatus.State.OK;
            case "STATUS_CANCEL" -> ActivationStatus.State.CANCEL;
            default -> ActivationStatus.State.UNKNOWN;
        };
        return new ActivationStatus(state, code);
    }

    public String parseSetStatus(String body) {
        if (SET_STATUS_REPLIES.contains(body)) {
            return body;
        }
        throw unexpected("setStatus", body);
    }

    public BigDecimal parseBalance(String body) {
        if (body.startsWith(ACCESS_BALANCE)) {
            try {
                return new BigDecimal(body.substring(ACCESS_BALANCE.length()).trim());
            } catch (NumberFormatException e) {
                throw unexpected("getBalance", body);
            }
        }
        throw unexpected("getBalance", body);
    }

    public String parseFullSms(String body) {
        if (body.startsWith(FULL_SMS)) {
            return body.substring(FULL_SMS.length());
        }
        throw unexpected("getFullSms", body);
    }

    /**
     * Reads the unit cost of a service from a {@code {country: {service: {cost, count}}}} document.
     *
     * @return the cost, or zero when the service is not offered for that country
     */
    public BigDecimal parsePrice(String body, String country, String service) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderErrorCode.UNEXPECTED_RESPONSE,
                "Price document is not valid JSON", null, e);
        }
        JsonNode cost = root.path(country).path(service).path("cost");
        if (cost.isMissingNode() || cost.isNull()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(cost.asText());
        } catch (NumberFormatException e) {
            throw new ProviderException(ProviderErrorCode.UNEXPECTED_RESPONSE,
                "Price is not numeric: " + cost.asText(), null, e);
        }
    }

    private ProviderException unexpected(String action, String body) {
        return new ProviderException(ProviderErrorCode.UNEXPECTED_RESPONSE,
            "Unexpected " + action + " response: " + body);
    }
}
