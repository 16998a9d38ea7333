package com.flagship.number_gateway.deposit;

import java.math.BigDecimal;

public interface PaymentProcessorClient {

    /**
     * Opens a hosted checkout for the reference.
     *
     * @return the link the user follows to pay
     * @throws PaymentProcessorException when no checkout could be created
     */
    String createCheckout(String txRef, String userId, BigDecimal amount, String currency);

    /**
     * Looks up the current state of a reference.
     *
     * @throws PaymentProcessorException when the processor could not answer
     */
    ProcessorVerification verify(String txRef);
}
