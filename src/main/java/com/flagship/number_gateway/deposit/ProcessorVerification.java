package com.flagship.number_gateway.deposit;

import lombok.Value;

import java.math.BigDecimal;

/**
 * The processor's view of a transaction reference.
 */
@Value
public class ProcessorVerification {

    public static final String SUCCESSFUL = "successful";
    public static final String NOT_ACTIVATED = "NOT_ACTIVATED";

    String status;
    String providerTxId;
    BigDecimal amount;
    String currency;

    /**
     * The user never completed checkout, so the processor has no transaction for the reference.
     */
    public static ProcessorVerification notActivated() {
        return new ProcessorVerification(NOT_ACTIVATED, null, null, null);
    }

    public boolean isSuccessful() {
        return SUCCESSFUL.equalsIgnoreCase(status);
    }

    public boolean isNotActivated() {
        return NOT_ACTIVATED.equals(status);
    }
}
