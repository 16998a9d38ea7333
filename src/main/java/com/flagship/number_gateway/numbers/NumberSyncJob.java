package com.flagship.number_gateway.numbers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;

/**
 * Expires overdue waiting numbers and polls the provider for codes on active ones.
 *
 * One failing activation never stops the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "numbers.sync.enabled", havingValue = "true", matchIfMissing = true)
public class NumberSyncJob {

    private final PurchaseOrchestrator orchestrator;
    private final NumberPurchaseRepository repository;
    private final NumbersProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${numbers.sync.interval-ms:30000}")
    public void run() {
        int expired = expireOverdue();
        int synced = syncActive();
        if (expired > 0 || synced > 0) {
            log.info("Number sync finished: expired={}, synced={}", expired, synced);
        }
    }

    int expireOverdue() {
        List<NumberPurchaseEntity> overdue = repository.findByStatusAndExpiresAtBefore(
            NumberStatus.WAITING, clock.instant(), PageRequest.of(0, properties.getSync().getBatchSize()));
        int count = 0;
        for (NumberPurchaseEntity entity : overdue) {
            try {
                if (orchestrator.expire(entity.getActivationId()).getNotification() != null) {
                    count++;
                }
            } catch (Exception e) {
                log.warn("Failed to expire activation {}: {}", entity.getActivationId(), e.getMessage());
            }
        }
        return count;
    }

    int syncActive() {
        List<NumberPurchaseEntity> active = repository.findByStatusInOrderByUpdatedAtAsc(
            EnumSet.of(NumberStatus.WAITING, NumberStatus.RECEIVED),
            PageRequest.of(0, properties.getSync().getBatchSize()));
        int count = 0;
        for (NumberPurchaseEntity entity : active) {
            try {
                orchestrator.syncActivation(entity.getActivationId());
                count++;
            } catch (Exception e) {
                log.warn("Status sync failed for activation {}: {}", entity.getActivationId(), e.getMessage());
            }
        }
        return count;
    }
}
