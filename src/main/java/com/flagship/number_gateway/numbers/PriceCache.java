package com.flagship.number_gateway.numbers;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived cache of provider unit prices.
 *
 * Backed by Redis when {@code numbers.price-cache.backend=redis} and a template is available, otherwise by
 * an in-process map. A Redis failure is treated as a miss; the provider stays the source of truth.
 */
@Slf4j
@Component
public class PriceCache {

    private static final String REDIS_KEY_PREFIX = "prices:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CachedPrice> local = new ConcurrentHashMap<>();

    public PriceCache(NumbersProperties properties, Optional<StringRedisTemplate> redisTemplate, Clock clock) {
        boolean useRedis = "redis".equalsIgnoreCase(properties.getPriceCache().getBackend());
        this.redisTemplate = useRedis ? redisTemplate : Optional.empty();
        this.ttl = properties.getPriceCache().getTtl();
        this.clock = clock;
        log.info("Price cache backend: {}", this.redisTemplate.isPresent() ? "redis" : "local");
    }

    public Optional<BigDecimal> get(String service, String country) {
        String key = key(service, country);
        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + key);
                return Optional.ofNullable(cached).map(BigDecimal::new);
            } catch (Exception e) {
                log.warn("Redis price lookup failed for {}: {}", key, e.getMessage());
                return Optional.empty();
            }
        }
        CachedPrice cached = local.get(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (clock.instant().isAfter(cached.getExpiresAt())) {
            local.remove(key, cached);
            return Optional.empty();
        }
        return Optional.of(cached.getPrice());
    }

    public void put(String service, String country, BigDecimal price) {
        String key = key(service, country);
        if (redisTemplate.isPresent()) {
            try {
                redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + key, price.toPlainString(), ttl);
            } catch (Exception e) {
                log.debug("Failed to cache price in Redis for {}: {}", key, e.getMessage());
            }
            return;
        }
        local.put(key, new CachedPrice(price, clock.instant().plus(ttl)));
    }

    public void evict(String service, String country) {
        String key = key(service, country);
        local.remove(key);
        redisTemplate.ifPresent(template -> {
            try {
                template.delete(REDIS_KEY_PREFIX + key);
            } catch (Exception e) {
                log.debug("Failed to evict price from Redis for {}: {}", key, e.getMessage());
            }
        });
    }

    private static String key(String service, String country) {
        return country + ":" + service;
    }

    @Value
    private static class CachedPrice {
        BigDecimal price;
        Instant expiresAt;
    }
}
