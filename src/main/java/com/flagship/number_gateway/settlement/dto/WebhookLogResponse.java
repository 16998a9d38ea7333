package com.flagship.number_gateway.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.settlement.WebhookLogEntity;
import com.flagship.number_gateway.settlement.WebhookSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WebhookLogResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("tx_ref")
    String txRef;

    @JsonProperty("provider_tx_id")
    String providerTxId;

    @JsonProperty("source")
    WebhookSource source;

    @JsonProperty("signature_valid")
    boolean signatureValid;

    @JsonProperty("processed")
    boolean processed;

    @JsonProperty("already_processed")
    boolean alreadyProcessed;

    @JsonProperty("processing_error")
    String processingError;

    @JsonProperty("processing_time_ms")
    Long processingTimeMs;

    @JsonProperty("received_at")
    Instant receivedAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static WebhookLogResponse from(WebhookLogEntity entry) {
        return WebhookLogResponse.builder()
            .id(entry.getId())
            .eventType(entry.getEventType())
            .txRef(entry.getTxRef())
            .providerTxId(entry.getProviderTxId())
            .source(entry.getSource())
            .signatureValid(entry.isSignatureValid())
            .processed(entry.isProcessed())
            .alreadyProcessed(entry.isAlreadyProcessed())
            .processingError(entry.getProcessingError())
            .processingTimeMs(entry.getProcessingTimeMs())
            .receivedAt(entry.getReceivedAt())
            .processedAt(entry.getProcessedAt())
            .build();
    }
}
