package com.flagship.number_gateway.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WebhookStats {
    Instant since;
    long total;
    long invalidSignature;
    long processed;
    long alreadyProcessed;
    long failed;
    double averageProcessingMs;
}
