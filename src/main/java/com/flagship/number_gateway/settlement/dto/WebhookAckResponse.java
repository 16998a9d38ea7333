package com.flagship.number_gateway.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.settlement.WebhookReceipt;
import lombok.Value;

import java.util.UUID;

@Value
public class WebhookAckResponse {

    @JsonProperty("received")
    boolean received;

    @JsonProperty("processed")
    boolean processed;

    @JsonProperty("already_processed")
    boolean alreadyProcessed;

    @JsonProperty("webhook_id")
    UUID webhookId;

    public static WebhookAckResponse from(WebhookReceipt receipt) {
        return new WebhookAckResponse(true, receipt.isProcessed(), receipt.isAlreadyProcessed(), receipt.getWebhookId());
    }
}
