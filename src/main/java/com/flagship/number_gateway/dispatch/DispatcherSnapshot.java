package com.flagship.number_gateway.dispatch;

import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of the dispatcher for health checks and metrics.
 */
@Value
public class DispatcherSnapshot {

    @Value
    public static class LaneSnapshot {
        int queueDepth;
        int inFlight;
        int concurrency;
        double backoffMultiplier;
    }

    LaneSnapshot read;
    LaneSnapshot write;
    boolean coolingDown;
    Instant cooldownUntil;
}
