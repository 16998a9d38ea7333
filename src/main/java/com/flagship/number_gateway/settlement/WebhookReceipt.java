package com.flagship.number_gateway.settlement;

import lombok.Value;

import java.util.UUID;

/**
 * Acknowledgement returned for every logged webhook, whatever processing made of it.
 */
@Value
public class WebhookReceipt {
    UUID webhookId;
    boolean processed;
    boolean alreadyProcessed;
}
