package com.flagship.number_gateway.dispatch;

import java.time.Duration;
import java.util.Random;

/**
 * Adaptive spacing arithmetic for a dispatcher lane.
 *
 * The multiplier doubles on each throttle up to a cap and decays geometrically back toward 1 on success.
 */
public class BackoffPolicy {

    private final double maxMultiplier;
    private final double decayFactor;
    private final Duration maxJitter;
    private final Duration severeThreshold;
    private final Random random;

    public BackoffPolicy(double maxMultiplier, double decayFactor, Duration maxJitter,
                         Duration severeThreshold, Random random) {
        if (maxMultiplier < 1.0) {
            throw new IllegalArgumentException("Max backoff multiplier must be at least 1");
        }
        if (decayFactor <= 0 || decayFactor > 1.0) {
            throw new IllegalArgumentException("Decay factor must be in (0, 1]");
        }
        this.maxMultiplier = maxMultiplier;
        this.decayFactor = decayFactor;
        this.maxJitter = maxJitter == null ? Duration.ZERO : maxJitter;
        this.severeThreshold = severeThreshold;
        this.random = random;
    }

    public static BackoffPolicy from(DispatcherProperties properties) {
        return new BackoffPolicy(properties.getMaxBackoffMultiplier(), properties.getBackoffDecayFactor(),
            properties.getMaxJitter(), properties.getSevereThrottleThreshold(), new Random());
    }

    public double increase(double multiplier) {
        return Math.min(maxMultiplier, multiplier * 2.0);
    }

    public double decay(double multiplier) {
        return Math.max(1.0, multiplier * decayFactor);
    }

    /**
     * minDelay x multiplier plus uniform jitter in [0, maxJitter].
     */
    public Duration spacing(Duration minDelay, double multiplier) {
        long base = Math.round(minDelay.toMillis() * multiplier);
        return Duration.ofMillis(base + jitterMillis());
    }

    public boolean isSevere(Duration retryAfter) {
        return retryAfter != null && severeThreshold != null && retryAfter.compareTo(severeThreshold) >= 0;
    }

    private long jitterMillis() {
        long bound = maxJitter.toMillis();
        if (bound <= 0) {
            return 0;
        }
        synchronized (random) {
            return (long) (random.nextDouble() * (bound + 1));
        }
    }
}
