package com.flagship.number_gateway.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.settlement.WebhookStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WebhookStatsResponse {

    @JsonProperty("since")
    Instant since;

    @JsonProperty("total")
    long total;

    @JsonProperty("invalid_signature")
    long invalidSignature;

    @JsonProperty("processed")
    long processed;

    @JsonProperty("already_processed")
    long alreadyProcessed;

    @JsonProperty("failed")
    long failed;

    @JsonProperty("average_processing_ms")
    double averageProcessingMs;

    public static WebhookStatsResponse from(WebhookStats stats) {
        return WebhookStatsResponse.builder()
            .since(stats.getSince())
            .total(stats.getTotal())
            .invalidSignature(stats.getInvalidSignature())
            .processed(stats.getProcessed())
            .alreadyProcessed(stats.getAlreadyProcessed())
            .failed(stats.getFailed())
            .averageProcessingMs(stats.getAverageProcessingMs())
            .build();
    }
}
