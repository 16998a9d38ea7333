package com.flagship.number_gateway.error;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
public class ApiError {
    String error;
    String code;
    String message;
    boolean retryable;
    Map<String, String> details;
    Instant timestamp;
}
