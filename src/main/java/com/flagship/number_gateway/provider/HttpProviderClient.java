package com.flagship.number_gateway.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;

/**
 * {@link ProviderClient} over plain HTTP GET, one attempt per call.
 */
@Slf4j
@Component
public class HttpProviderClient implements ProviderClient {

    private static final ThreadLocal<Duration> CALL_BUDGET = new ThreadLocal<>();

    private final ProviderProperties properties;
    private final ProviderResponseCodec codec;
    private final RestTemplate restTemplate;

    @Autowired
    public HttpProviderClient(ProviderProperties properties, ProviderResponseCodec codec) {
        this(properties, codec, createRestTemplate(properties));
    }

    HttpProviderClient(ProviderProperties properties, ProviderResponseCodec codec, RestTemplate restTemplate) {
        this.properties = properties;
        this.codec = codec;
        this.restTemplate = restTemplate;
    }

    private static RestTemplate createRestTemplate(ProviderProperties properties) {
        SimpleClientHttpRequestFactory factory = new BudgetedRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }

    @Override
    public ProviderReply execute(ProviderRequest request, Duration budget) {
        CALL_BUDGET.set(budget);
        try {
            return execute(request);
        } finally {
            CALL_BUDGET.remove();
        }
    }

    @Override
    public ProviderReply execute(ProviderRequest request) {
        ProviderAction action = request.getAction();
        URI uri = buildUri(request);
        log.debug("Provider request: action={}, params={}", action.getWireName(), request.getParams());

        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            throw translate(action, e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ProviderException(ProviderErrorCode.TRANSPORT_TIMEOUT,
                    "Provider timed out on " + action.getWireName(), null, e);
            }
            throw new ProviderException(ProviderErrorCode.TRANSPORT_FAILURE,
                "Provider unreachable on " + action.getWireName() + ": " + e.getMessage(), null, e);
        }

        String screened = codec.screen(action, body);
        log.debug("Provider response: action={}, body={}", action.getWireName(), screened);
        return new ProviderReply(action, screened);
    }

    private URI buildUri(ProviderRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
            .queryParam("api_key", properties.getApiKey())
            .queryParam("action", request.getAction().getWireName());
        request.getParams().forEach(builder::queryParam);
        return builder.encode().build().toUri();
    }

    private ProviderException translate(ProviderAction action, HttpStatusCodeException e) {
        if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
            log.warn("Provider throttled {}: retryAfter={}", action.getWireName(), retryAfter);
            return new ProviderException(ProviderErrorCode.HTTP_429,
                "Provider rate limited " + action.getWireName(), retryAfter, e);
        }
        String body = e.getResponseBodyAsString();
        var token = ProviderErrorCode.fromToken(body);
        if (token.isPresent()) {
            return new ProviderException(token.get(), "Provider returned " + body.trim(), null, e);
        }
        if (e.getStatusCode().is5xxServerError()) {
            return new ProviderException(ProviderErrorCode.TRANSPORT_FAILURE,
                "Provider HTTP " + e.getStatusCode().value() + " on " + action.getWireName(), null, e);
        }
        return new ProviderException(ProviderErrorCode.UNEXPECTED_RESPONSE,
            "Provider HTTP " + e.getStatusCode().value() + " on " + action.getWireName(), null, e);
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", value);
            return null;
        }
    }

    /**
     * Caps connect and read timeouts so that both phases together fit in the calling thread's budget.
     */
    static class BudgetedRequestFactory extends SimpleClientHttpRequestFactory {

        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
            super.prepareConnection(connection, httpMethod);
            Duration budget = CALL_BUDGET.get();
            if (budget == null) {
                return;
            }
            // 0 means infinite for HttpURLConnection, so never go below 1ms
            long total = Math.max(2, budget.toMillis());
            int connect = cap(connection.getConnectTimeout(), Math.max(1, total / 2));
            int read = cap(connection.getReadTimeout(), Math.max(1, total - connect));
            connection.setConnectTimeout(connect);
            connection.setReadTimeout(read);
        }

        static void withBudget(Duration budget, Runnable action) {
            CALL_BUDGET.set(budget);
            try {
                action.run();
            } finally {
                CALL_BUDGET.remove();
            }
        }

        private static int cap(int configured, long limit) {
            int bounded = (int) Math.min(Integer.MAX_VALUE, limit);
            return configured <= 0 ? bounded : Math.min(configured, bounded);
        }
    }
}
