package com.flagship.number_gateway.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the provider gateway and the settlement engine.
 *
 * Metrics exposed:
 * - provider.dispatch: provider calls by action and outcome
 * - provider.throttled: throttling replies by lane
 * - provider.dispatch.latency: time from submit to completion
 * - provider.lane.*: queue depth, in-flight count and backoff multiplier per lane
 * - numbers.purchases / numbers.refunds: purchase orchestration outcomes
 * - settlement.outcomes / webhook.received: settlement engine outcomes
 * - ledger.reconciliation_required: provider state that diverged from the ledger
 */
@Component
public class GatewayMetrics {

    private final MeterRegistry registry;

    private final Counter reconciliationRequired;
    private final Counter globalCooldowns;
    private final Timer settlementTimer;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.reconciliationRequired = Counter.builder("ledger.reconciliation_required")
                .description("Provider-side effects the ledger did not record")
                .register(registry);

        this.globalCooldowns = Counter.builder("provider.cooldowns")
                .description("Severe throttling signals that paused every lane")
                .register(registry);

        this.settlementTimer = Timer.builder("settlement.duration")
                .description("Time taken to settle a deposit")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Dispatcher ====================

    public void recordDispatch(String action, String outcome, Duration latency) {
        registry.counter("provider.dispatch",
                "action", sanitizeTag(action),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("provider.dispatch.latency",
                "action", sanitizeTag(action)
        ).record(latency);
    }

    public void recordThrottle(String lane) {
        registry.counter("provider.throttled", "lane", sanitizeTag(lane)).increment();
    }

    public void recordGlobalCooldown() {
        globalCooldowns.increment();
    }

    /**
     * Registers the gauges of one dispatcher lane. Suppliers are held strongly.
     */
    public void registerLaneGauges(String lane, Supplier<Number> queueDepth,
                                   Supplier<Number> inFlight, Supplier<Number> multiplier) {
        Gauge.builder("provider.lane.queue_depth", queueDepth)
                .description("Requests waiting in the lane")
                .tag("lane", lane)
                .register(registry);
        Gauge.builder("provider.lane.in_flight", inFlight)
                .description("Requests currently executing in the lane")
                .tag("lane", lane)
                .register(registry);
        Gauge.builder("provider.lane.backoff_multiplier", multiplier)
                .description("Current adaptive backoff multiplier")
                .tag("lane", lane)
                .register(registry);
    }

    // ==================== Numbers ====================

    public void recordPurchase(String outcome) {
        registry.counter("numbers.purchases", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRefund(String policy) {
        registry.counter("numbers.refunds", "policy", sanitizeTag(policy)).increment();
    }

    public void recordNumberTransition(String status) {
        registry.counter("numbers.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordReconciliationRequired() {
        reconciliationRequired.increment();
    }

    // ==================== Settlement ====================

    public void recordWebhookReceived(String eventType, boolean signatureValid) {
        registry.counter("webhook.received",
                "event_type", sanitizeTag(eventType),
                "signature_valid", String.valueOf(signatureValid)
        ).increment();
    }

    public void recordSettlementOutcome(String outcome) {
        registry.counter("settlement.outcomes", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    public void recordDepositCreated(String currency) {
        registry.counter("deposits.created", "currency", sanitizeTag(currency)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
