package com.flagship.number_gateway.deposit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flutterwave-style REST client: bearer secret key, JSON envelopes of {@code {status, message, data}}.
 */
@Slf4j
@Component
public class HttpPaymentProcessorClient implements PaymentProcessorClient {

    private final PaymentsProperties properties;
    private final ObjectMapper objectMapper;
    private final RestTemplate restTemplate;

    @Autowired
    public HttpPaymentProcessorClient(PaymentsProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, createRestTemplate(properties));
    }

    HttpPaymentProcessorClient(PaymentsProperties properties, ObjectMapper objectMapper, RestTemplate restTemplate) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplate;
    }

    private static RestTemplate createRestTemplate(PaymentsProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }

    @Override
    public String createCheckout(String txRef, String userId, BigDecimal amount, String currency) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tx_ref", txRef);
        payload.put("amount", amount.toPlainString());
        payload.put("currency", currency);
        payload.put("redirect_url", properties.getRedirectUrl() + "?tx_ref=" + txRef);
        payload.put("customizations", Map.of("title", "Account Balance Top-up"));
        payload.put("meta", Map.of("user_id", userId));

        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getProcessorBaseUrl())
            .path("/payments")
            .build()
            .toUri();
        log.info("Creating checkout: txRef={}, amount={}, currency={}", txRef, amount, currency);

        JsonNode data;
        try {
            data = exchange(HttpMethod.POST, uri, payload, "create checkout for " + txRef);
        } catch (NotFound e) {
            throw new PaymentProcessorException("Processor checkout endpoint not found for " + txRef);
        }
        String link = data.path("link").asText(null);
        if (link == null || link.isBlank()) {
            throw new PaymentProcessorException("Processor returned no checkout link for " + txRef);
        }
        return link;
    }

    @Override
    public ProcessorVerification verify(String txRef) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getProcessorBaseUrl())
            .path("/transactions/verify_by_reference")
            .queryParam("tx_ref", txRef)
            .encode()
            .build()
            .toUri();

        JsonNode data;
        try {
            data = exchange(HttpMethod.GET, uri, null, "verify " + txRef);
        } catch (NotFound e) {
            log.info("Processor has no transaction for txRef={}", txRef);
            return ProcessorVerification.notActivated();
        }

        BigDecimal amount = data.hasNonNull("amount") ? data.get("amount").decimalValue() : null;
        return new ProcessorVerification(
            data.path("status").asText(""),
            data.hasNonNull("id") ? data.get("id").asText() : null,
            amount,
            data.path("currency").asText(null)
        );
    }

    private JsonNode exchange(HttpMethod method, URI uri, Object body, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getProcessorSecretKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                || e.getResponseBodyAsString().contains("No transaction was found")) {
                throw new NotFound();
            }
            log.warn("Processor call failed: operation={}, status={}, body={}",
                operation, e.getStatusCode(), e.getResponseBodyAsString());
            throw new PaymentProcessorException(
                "Processor rejected " + operation + " with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new PaymentProcessorException("Processor unreachable during " + operation + ": " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new PaymentProcessorException("Unreadable processor response during " + operation, e);
        }
        if (root == null || !"success".equalsIgnoreCase(root.path("status").asText())) {
            String message = root != null ? root.path("message").asText("") : "";
            throw new PaymentProcessorException("Processor reported failure during " + operation + ": " + message);
        }
        return root.path("data");
    }

    private static final class NotFound extends RuntimeException {
        NotFound() {
            super(null, null, false, false);
        }
    }
}
