package com.flagship.number_gateway.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for one inbound payment notification or manual verification attempt.
 *
 * The raw payload is stored exactly as received. Only the processing outcome columns change after insert.
 */
@Entity
@Table(name = "webhook_logs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WebhookLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @Column(name = "tx_ref", updatable = false)
    private String txRef;

    @Column(name = "provider_tx_id", updatable = false)
    private String providerTxId;

    @Column(name = "raw_payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "signature_valid", nullable = false, updatable = false)
    private boolean signatureValid;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private WebhookSource source;

    @Column(nullable = false)
    private boolean processed;

    @Column(name = "already_processed", nullable = false)
    private boolean alreadyProcessed;

    @Column(name = "processing_error", columnDefinition = "TEXT")
    private String processingError;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    static WebhookLogEntity received(String eventType, String txRef, String providerTxId, String rawPayload,
                                     boolean signatureValid, String idempotencyKey, WebhookSource source,
                                     Instant receivedAt) {
        return new WebhookLogEntity(UUID.randomUUID(), eventType, txRef, providerTxId, rawPayload, signatureValid,
            idempotencyKey, source, false, false, null, null, receivedAt, null);
    }

    void recordResult(boolean processed, boolean alreadyProcessed, String error, long latencyMs, Instant now) {
        this.processed = processed;
        this.alreadyProcessed = alreadyProcessed;
        this.processingError = error;
        this.processingTimeMs = latencyMs;
        this.processedAt = now;
    }
}
