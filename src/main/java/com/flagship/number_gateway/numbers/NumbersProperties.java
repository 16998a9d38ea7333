package com.flagship.number_gateway.numbers;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Pricing, lease and refund settings for number purchases.
 */
@Data
@Component
@ConfigurationProperties(prefix = "numbers")
public class NumbersProperties {

    private BigDecimal markupMultiplier = new BigDecimal("2.0");

    private Duration leaseDuration = Duration.ofMinutes(20);

    /** Minimum time between purchase and a user cancel. */
    private Duration minCancelDwell = Duration.ofMinutes(4);

    private RefundPolicy.Type refundPolicy = RefundPolicy.Type.FULL;

    private BigDecimal decayRefundFactor = new BigDecimal("0.5");

    private PriceCacheSettings priceCache = new PriceCacheSettings();

    private Sync sync = new Sync();

    @Data
    public static class PriceCacheSettings {
        private Duration ttl = Duration.ofSeconds(600);
        /** "redis" or "local". */
        private String backend = "redis";
    }

    @Data
    public static class Sync {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private int batchSize = 50;
    }
}
