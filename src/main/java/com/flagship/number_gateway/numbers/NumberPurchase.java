package com.flagship.number_gateway.numbers;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A number leased from the provider on behalf of a user.
 *
 * Transitions are explicit and return new instances:
 * - WAITING to RECEIVED when a code arrives (RECEIVED to RECEIVED for a newer code)
 * - WAITING to EXPIRED once the lease has run out
 * - WAITING or RECEIVED to CANCELLED
 * - RECEIVED to USED on completion
 */
@Value
@With(lombok.AccessLevel.PRIVATE)
public class NumberPurchase {
    UUID id;
    String activationId;
    String userId;
    String phoneNumber;
    String countryCode;
    String serviceCode;
    String operator;
    BigDecimal providerCost;
    BigDecimal price;
    NumberStatus status;
    Instant purchasedAt;
    Instant expiresAt;
    String smsCode;
    String smsText;
    Instant receivedAt;
    BigDecimal refundedAmount;

    public static NumberPurchase create(String activationId, String userId, String phoneNumber,
                                        String countryCode, String serviceCode, String operator,
                                        BigDecimal providerCost, BigDecimal price,
                                        Instant purchasedAt, Duration leaseDuration) {
        return new NumberPurchase(
            UUID.randomUUID(),
            activationId,
            userId,
            phoneNumber,
            countryCode,
            serviceCode,
            operator,
            providerCost,
            price,
            NumberStatus.WAITING,
            purchasedAt,
            purchasedAt.plus(leaseDuration),
            null,
            null,
            null,
            null
        );
    }

    /**
     * Records a code reported by the provider.
     *
     * @throws IllegalStateException unless WAITING or RECEIVED
     */
    public NumberPurchase receiveCode(String code, Instant now) {
        if (!status.isActive()) {
            throw new IllegalStateException(
                String.format("Cannot receive a code for number %s in %s status", activationId, status));
        }
        return withStatus(NumberStatus.RECEIVED).withSmsCode(code).withReceivedAt(now);
    }

    public NumberPurchase expire(Instant now) {
        if (status != NumberStatus.WAITING) {
            throw new IllegalStateException(
                String.format("Cannot expire number %s in %s status. Only WAITING numbers expire.", activationId, status));
        }
        if (!isPastExpiry(now)) {
            throw new IllegalStateException("Number " + activationId + " has not reached its expiry " + expiresAt);
        }
        return withStatus(NumberStatus.EXPIRED);
    }

    /**
     * @param refund amount returned to the user, zero when nothing is refunded
     */
    public NumberPurchase cancel(BigDecimal refund) {
        if (!status.isActive()) {
            throw new IllegalStateException(
                String.format("Cannot cancel number %s in %s status", activationId, status));
        }
        if (refund.signum() < 0 || refund.compareTo(price) > 0) {
            throw new IllegalArgumentException("Refund must be between 0 and the price paid: " + refund);
        }
        return withStatus(NumberStatus.CANCELLED).withRefundedAmount(refund);
    }

    public NumberPurchase complete() {
        if (status != NumberStatus.RECEIVED) {
            throw new IllegalStateException(
                String.format("Cannot complete number %s in %s status. Only RECEIVED numbers can be completed.",
                    activationId, status));
        }
        return withStatus(NumberStatus.USED);
    }

    /**
     * Starts a fresh lease period after the provider accepted a retry.
     */
    public NumberPurchase extendLease(Instant now, Duration leaseDuration) {
        if (status != NumberStatus.WAITING) {
            throw new IllegalStateException(
                String.format("Cannot extend number %s in %s status", activationId, status));
        }
        return withExpiresAt(now.plus(leaseDuration));
    }

    public NumberPurchase withFullText(String text) {
        if (status != NumberStatus.RECEIVED) {
            throw new IllegalStateException("No SMS received yet for number " + activationId);
        }
        return withSmsText(text);
    }

    public boolean isPastExpiry(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isCancellableAt(Instant now, Duration minDwell) {
        return !now.isBefore(purchasedAt.plus(minDwell));
    }

    /**
     * Fraction of the lease still unused at {@code now}, in [0, 1].
     */
    public double remainingLeaseFraction(Instant now) {
        long total = Duration.between(purchasedAt, expiresAt).toMillis();
        if (total <= 0) {
            return 0.0;
        }
        long remaining = Duration.between(now, expiresAt).toMillis();
        return Math.max(0.0, Math.min(1.0, (double) remaining / total));
    }

    public BigDecimal getMarkup() {
        return price.subtract(providerCost);
    }
}
