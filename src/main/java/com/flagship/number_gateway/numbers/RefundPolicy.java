package com.flagship.number_gateway.numbers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Decides how much of the price is returned when a user cancels a number.
 */
public interface RefundPolicy {

    enum Type {
        FULL,
        TIME_DECAYED
    }

    Type type();

    /**
     * @return the refund, between zero and the price paid, at scale 4
     */
    BigDecimal refundFor(NumberPurchase purchase, Instant now);

    /**
     * Refunds the whole price.
     */
    class Full implements RefundPolicy {

        @Override
        public Type type() {
            return Type.FULL;
        }

        @Override
        public BigDecimal refundFor(NumberPurchase purchase, Instant now) {
            return purchase.getPrice().setScale(MarkupPolicy.SCALE, RoundingMode.HALF_DOWN);
        }
    }

    /**
     * Refunds price x unused fraction of the lease x factor.
     */
    class TimeDecayed implements RefundPolicy {

        private final BigDecimal factor;

        public TimeDecayed(BigDecimal factor) {
            if (factor == null || factor.signum() < 0 || factor.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("Refund factor must be in [0, 1]: " + factor);
            }
            this.factor = factor;
        }

        @Override
        public Type type() {
            return Type.TIME_DECAYED;
        }

        @Override
        public BigDecimal refundFor(NumberPurchase purchase, Instant now) {
            BigDecimal remaining = BigDecimal.valueOf(purchase.remainingLeaseFraction(now));
            return purchase.getPrice()
                .multiply(remaining)
                .multiply(factor)
                .setScale(MarkupPolicy.SCALE, RoundingMode.HALF_DOWN);
        }
    }
}
