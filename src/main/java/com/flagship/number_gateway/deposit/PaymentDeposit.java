package com.flagship.number_gateway.deposit;

import lombok.AccessLevel;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A checkout session opened with the payment processor.
 *
 * Transitions:
 * - PENDING_UNSETTLED to PAID_SETTLED when the payment is confirmed
 * - PENDING_UNSETTLED to FAILED when the processor reports a failure or reversal
 * - PENDING_UNSETTLED to CANCELLED by the user, or when the session expires unused
 * - CANCELLED to PAID_SETTLED when a payment confirmation arrives for a cancelled session
 *
 * PAID_SETTLED and FAILED are terminal. A cancelled checkout link can still be paid, so CANCELLED is not.
 */
@Value
@With(AccessLevel.PRIVATE)
public class PaymentDeposit {
    UUID id;
    String txRef;
    String userId;
    String providerTxId;
    BigDecimal amount;
    String currency;
    BigDecimal settlementEquivalent;
    BigDecimal exchangeRate;
    BigDecimal settledAmount;
    DepositStatus status;
    String failureReason;
    String paymentLink;
    Instant expiresAt;
    Instant paidAt;
    Instant createdAt;

    public static PaymentDeposit create(String txRef, String userId, BigDecimal amount, String currency,
                                        BigDecimal quotedEquivalent, BigDecimal exchangeRate, String paymentLink,
                                        Instant now, Duration ttl) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive: " + amount);
        }
        return new PaymentDeposit(
            UUID.randomUUID(),
            txRef,
            userId,
            null,
            amount,
            currency.toUpperCase(Locale.ROOT),
            quotedEquivalent,
            exchangeRate,
            null,
            DepositStatus.PENDING_UNSETTLED,
            null,
            paymentLink,
            now.plus(ttl),
            null,
            now
        );
    }

    /**
     * Builds a reference of the form {@code DEP_<user>_<epochMillis>_<RANDOM6>}.
     */
    public static String newTxRef(String userId, Instant now, String random6) {
        if (random6 == null || random6.length() != 6) {
            throw new IllegalArgumentException("Random suffix must be 6 characters");
        }
        return "DEP_" + userId + "_" + now.toEpochMilli() + "_" + random6.toUpperCase(Locale.ROOT);
    }

    public PaymentDeposit settle(String providerTxId, BigDecimal settledAmount, BigDecimal rate,
                                 BigDecimal equivalent, Instant paidAt) {
        if (status != DepositStatus.PENDING_UNSETTLED && status != DepositStatus.CANCELLED) {
            throw new IllegalStateException(
                String.format("Cannot settle deposit %s in %s status", txRef, status));
        }
        return withStatus(DepositStatus.PAID_SETTLED)
            .withProviderTxId(providerTxId)
            .withSettledAmount(settledAmount)
            .withExchangeRate(rate)
            .withSettlementEquivalent(equivalent)
            .withPaidAt(paidAt)
            .withFailureReason(null);
    }

    public PaymentDeposit fail(String reason) {
        requirePending("fail");
        return withStatus(DepositStatus.FAILED).withFailureReason(reason);
    }

    public PaymentDeposit cancel(String reason) {
        requirePending("cancel");
        return withStatus(DepositStatus.CANCELLED).withFailureReason(reason);
    }

    public boolean isPending() {
        return status == DepositStatus.PENDING_UNSETTLED;
    }

    public boolean isPastExpiry(Instant now) {
        return now.isAfter(expiresAt);
    }

    private void requirePending(String operation) {
        if (status != DepositStatus.PENDING_UNSETTLED) {
            throw new IllegalStateException(
                String.format("Cannot %s deposit %s in %s status", operation, txRef, status));
        }
    }
}
