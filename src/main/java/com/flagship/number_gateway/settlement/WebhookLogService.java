package com.flagship.number_gateway.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes the webhook audit trail. Each write commits on its own, independent of settlement.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookLogService {

    static final int SHORT_COLUMN = 64;
    static final int KEY_COLUMN = 256;

    private final WebhookLogRepository repository;
    private final Clock clock;

    /**
     * Persists the receipt before any processing.
     * Failures propagate so the caller can refuse the delivery and let the processor retry.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID logReceipt(String eventType, String txRef, String providerTxId, String rawPayload,
                           boolean signatureValid, String idempotencyKey, WebhookSource source) {
        WebhookLogEntity entry = WebhookLogEntity.received(clamp(eventType, SHORT_COLUMN),
            clamp(txRef, SHORT_COLUMN), clamp(providerTxId, SHORT_COLUMN), rawPayload, signatureValid,
            clamp(idempotencyKey, KEY_COLUMN), source, clock.instant());
        repository.saveAndFlush(entry);
        log.debug("Webhook receipt logged: id={}, event={}, txRef={}, source={}",
            entry.getId(), eventType, txRef, source);
        return entry.getId();
    }

    /**
     * Cuts a header field to its column width. The raw payload keeps the full value.
     */
    static String clamp(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        log.warn("Webhook field truncated from {} to {} characters", value.length(), max);
        return value.substring(0, max);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordResult(UUID id, boolean processed, boolean alreadyProcessed, String error, long latencyMs) {
        WebhookLogEntity entry = repository.findById(id)
            .orElseThrow(() -> new IllegalStateException("Webhook log entry vanished: " + id));
        entry.recordResult(processed, alreadyProcessed, error, latencyMs, clock.instant());
        repository.save(entry);
    }

    @Transactional(readOnly = true)
    public Page<WebhookLogEntity> list(String txRef, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size);
        if (txRef != null && !txRef.isBlank()) {
            return repository.findByTxRefOrderByReceivedAtDesc(txRef, pageable);
        }
        return repository.findAllByOrderByReceivedAtDesc(pageable);
    }

    @Transactional(readOnly = true)
    public List<WebhookLogEntity> findByTxRef(String txRef) {
        return repository.findByTxRefOrderByReceivedAtAsc(txRef);
    }

    @Transactional(readOnly = true)
    public WebhookStats stats(Duration window) {
        Instant since = clock.instant().minus(window);
        Double average = repository.averageProcessingTimeSince(since);
        return WebhookStats.builder()
            .since(since)
            .total(repository.countByReceivedAtAfter(since))
            .invalidSignature(repository.countByReceivedAtAfterAndSignatureValidFalse(since))
            .processed(repository.countByReceivedAtAfterAndProcessedTrue(since))
            .alreadyProcessed(repository.countByReceivedAtAfterAndAlreadyProcessedTrue(since))
            .failed(repository.countByReceivedAtAfterAndProcessingErrorIsNotNull(since))
            .averageProcessingMs(average != null ? average : 0.0)
            .build();
    }
}
