package com.flagship.number_gateway.dispatch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Pacing and retry settings for the provider dispatcher.
 */
@Data
@Component
@ConfigurationProperties(prefix = "provider.dispatcher")
public class DispatcherProperties {

    private int readConcurrency = 5;

    private Duration readMinDelay = Duration.ofMillis(200);

    private Duration writeMinDelay = Duration.ofMillis(1000);

    private Duration maxJitter = Duration.ofMillis(100);

    private double maxBackoffMultiplier = 6.0;

    private double backoffDecayFactor = 0.8;

    private int maxRetries = 5;

    private Duration requestTimeout = Duration.ofSeconds(30);

    /** A Retry-After at or above this pauses every lane. */
    private Duration severeThrottleThreshold = Duration.ofSeconds(10);

    private Duration tickInterval = Duration.ofMillis(25);

    private int workerThreads = 8;
}
