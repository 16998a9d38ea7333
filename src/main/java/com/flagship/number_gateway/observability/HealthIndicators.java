package com.flagship.number_gateway.observability;

import com.flagship.number_gateway.dispatch.DispatcherSnapshot;
import com.flagship.number_gateway.dispatch.RateLimitedDispatcher;
import com.flagship.number_gateway.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the gateway's collaborators.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many ledger events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the price cache, so an outage degrades rather than fails the service.
     */
    @Component("priceCacheRedisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response: " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Prices are fetched from the provider when the cache is unavailable")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down().withDetail("error", "No Kafka connections established").build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * DOWN while the provider has imposed a global cooldown; lane depths are reported either way.
     */
    @Component("providerDispatcherHealth")
    public static class DispatcherHealthIndicator implements HealthIndicator {

        private final RateLimitedDispatcher dispatcher;

        public DispatcherHealthIndicator(RateLimitedDispatcher dispatcher) {
            this.dispatcher = dispatcher;
        }

        @Override
        public Health health() {
            DispatcherSnapshot snapshot = dispatcher.snapshot();
            Health.Builder builder = snapshot.isCoolingDown() ? Health.down() : Health.up();
            return builder
                    .withDetail("readQueueDepth", snapshot.getRead().getQueueDepth())
                    .withDetail("readInFlight", snapshot.getRead().getInFlight())
                    .withDetail("readBackoffMultiplier", snapshot.getRead().getBackoffMultiplier())
                    .withDetail("writeQueueDepth", snapshot.getWrite().getQueueDepth())
                    .withDetail("writeInFlight", snapshot.getWrite().getInFlight())
                    .withDetail("writeBackoffMultiplier", snapshot.getWrite().getBackoffMultiplier())
                    .withDetail("cooldownUntil", snapshot.isCoolingDown() ? snapshot.getCooldownUntil().toString() : "none")
                    .build();
        }
    }
}
