package com.flagship.number_gateway.error;

import com.flagship.number_gateway.provider.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * Every failure is rendered as an {@link ApiError} with a stable machine-readable code.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGatewayException(GatewayException e) {
        ErrorCode code = e.getErrorCode();
        if (code.isRetryable()) {
            log.error("Request failed: code={}, message={}", code, e.getMessage());
        } else {
            log.info("Request rejected: code={}, message={}", code, e.getMessage());
        }
        return build(code, e.getMessage(), null);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiError> handleProviderException(ProviderException e) {
        ErrorCode code = ErrorCode.forProviderError(e);
        log.warn("Provider failure surfaced to caller: kind={}, code={}, message={}",
                e.getKind(), e.getCode(), e.getMessage());
        return build(code, code.getDefaultMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return build(ErrorCode.MISSING_HEADER,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return build(ErrorCode.VALIDATION_FAILED, ErrorCode.VALIDATION_FAILED.getDefaultMessage(), errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return build(ErrorCode.VALIDATION_FAILED, e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid State")
            .code("INVALID_STATE")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .retryable(true)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ApiError> build(ErrorCode code, String message, Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error(code.getHttpStatus().getReasonPhrase())
            .code(code.name())
            .message(message)
            .retryable(code.isRetryable())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(code.getHttpStatus()).body(error);
    }
}
