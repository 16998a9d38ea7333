package com.flagship.number_gateway.error;

import com.flagship.number_gateway.provider.ProviderErrorCode;
import com.flagship.number_gateway.provider.ProviderException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Closed set of caller-visible failure codes.
 *
 * Business outcomes (insufficient balance, no inventory, invalid state) map to 4xx.
 * Provider and transport failures map to retryable 5xx.
 */
@Getter
public enum ErrorCode {

    // Provider
    PROVIDER_RATE_LIMITED(Category.PROVIDER, HttpStatus.SERVICE_UNAVAILABLE,
            "Provider is busy, try again shortly"),
    PROVIDER_TIMEOUT(Category.PROVIDER, HttpStatus.GATEWAY_TIMEOUT, "Provider did not respond in time"),
    PROVIDER_ERROR(Category.PROVIDER, HttpStatus.BAD_GATEWAY, "Provider request failed"),
    PROVIDER_NO_BALANCE(Category.PROVIDER, HttpStatus.SERVICE_UNAVAILABLE,
            "Service temporarily unavailable, provider balance exhausted"),
    NO_NUMBERS_AVAILABLE(Category.PROVIDER, HttpStatus.CONFLICT, "No numbers available for this service"),
    INVALID_SERVICE(Category.PROVIDER, HttpStatus.BAD_REQUEST, "Invalid service or country"),
    PURCHASE_FAILED(Category.PROVIDER, HttpStatus.BAD_GATEWAY, "Number purchase failed"),

    // Ledger
    INSUFFICIENT_BALANCE(Category.LEDGER, HttpStatus.PAYMENT_REQUIRED, "Insufficient balance"),
    CONCURRENT_MODIFICATION(Category.LEDGER, HttpStatus.CONFLICT, "Concurrent modification, retry the request"),
    RECONCILIATION_REQUIRED(Category.LEDGER, HttpStatus.INTERNAL_SERVER_ERROR,
            "Operation could not be recorded and was flagged for reconciliation"),

    // Settlement
    INVALID_SIGNATURE(Category.SETTLEMENT, HttpStatus.UNAUTHORIZED, "Invalid webhook signature"),
    DEPOSIT_NOT_FOUND(Category.SETTLEMENT, HttpStatus.NOT_FOUND, "Deposit not found"),
    PAYMENT_NOT_ACTIVATED(Category.SETTLEMENT, HttpStatus.BAD_REQUEST,
            "Payment was not completed, the checkout session was never activated"),
    PAYMENT_EXPIRED(Category.SETTLEMENT, HttpStatus.BAD_REQUEST, "Payment session has expired"),
    PAYMENT_FAILED(Category.SETTLEMENT, HttpStatus.BAD_REQUEST, "Payment verification failed"),
    VERIFICATION_FAILED(Category.SETTLEMENT, HttpStatus.BAD_GATEWAY, "Payment processor verification failed"),
    DEPOSIT_CREATION_FAILED(Category.SETTLEMENT, HttpStatus.BAD_GATEWAY, "Payment session could not be created"),
    INVALID_STATUS_FOR_CANCELLATION(Category.SETTLEMENT, HttpStatus.CONFLICT,
            "Deposit cannot be cancelled in its current status"),

    // Validation and state
    VALIDATION_FAILED(Category.VALIDATION, HttpStatus.BAD_REQUEST, "Request validation failed"),
    MISSING_HEADER(Category.VALIDATION, HttpStatus.BAD_REQUEST, "Required header is missing"),
    INVALID_AMOUNT(Category.VALIDATION, HttpStatus.BAD_REQUEST, "Invalid amount"),
    SERVICE_UNAVAILABLE(Category.VALIDATION, HttpStatus.BAD_REQUEST,
            "Service not available for this country"),
    PRICE_EXCEEDED(Category.VALIDATION, HttpStatus.CONFLICT, "Price exceeds the requested maximum"),
    NUMBER_NOT_FOUND(Category.VALIDATION, HttpStatus.NOT_FOUND, "Number not found"),
    INVALID_STATUS_FOR_CANCEL(Category.VALIDATION, HttpStatus.CONFLICT,
            "Number cannot be cancelled in its current status"),
    CANCEL_TOO_EARLY(Category.VALIDATION, HttpStatus.CONFLICT,
            "Number cannot be cancelled yet, wait for the minimum dwell time"),
    INVALID_STATUS_FOR_COMPLETE(Category.VALIDATION, HttpStatus.CONFLICT,
            "Only numbers that received an SMS can be completed"),
    INVALID_STATUS_FOR_RETRY(Category.VALIDATION, HttpStatus.CONFLICT,
            "Only waiting numbers can request another SMS"),
    NUMBER_EXPIRED(Category.VALIDATION, HttpStatus.CONFLICT, "Number has expired"),
    SMS_NOT_RECEIVED(Category.VALIDATION, HttpStatus.CONFLICT, "No SMS received for this number yet");

    public enum Category {
        PROVIDER,
        LEDGER,
        SETTLEMENT,
        VALIDATION
    }

    private final Category category;
    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ErrorCode(Category category, HttpStatus httpStatus, String defaultMessage) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public boolean isRetryable() {
        return httpStatus.is5xxServerError();
    }

    /**
     * Maps a decoded provider failure onto the caller-visible code used outside the purchase path.
     */
    public static ErrorCode forProviderError(ProviderException e) {
        return switch (e.getKind()) {
            case RATE_LIMITED -> PROVIDER_RATE_LIMITED;
            case TIMEOUT -> PROVIDER_TIMEOUT;
            case NO_INVENTORY -> NO_NUMBERS_AVAILABLE;
            case INSUFFICIENT_PROVIDER_FUNDS -> PROVIDER_NO_BALANCE;
            case INVALID_REQUEST -> e.getCode() == ProviderErrorCode.BAD_SERVICE ? INVALID_SERVICE : PROVIDER_ERROR;
            case UPSTREAM -> PROVIDER_ERROR;
        };
    }
}
