package com.flagship.number_gateway.deposit;

/**
 * The payment processor could not be reached or returned an unusable answer.
 */
public class PaymentProcessorException extends RuntimeException {

    public PaymentProcessorException(String message) {
        super(message);
    }

    public PaymentProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
