package com.flagship.number_gateway.deposit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Payment processor, webhook and FX settings.
 */
@Data
@Component
@ConfigurationProperties(prefix = "payments")
public class PaymentsProperties {

    private String processorBaseUrl;

    private String processorSecretKey;

    /** Shared secret for webhook HMAC signatures. */
    private String webhookSecret;

    /** Accept unsigned webhooks. Local development only. */
    private boolean allowUnsigned = false;

    private String settlementCurrency = "USD";

    /** Added on top of the configured rate, e.g. 0.01 for 1%. */
    private BigDecimal fxMargin = new BigDecimal("0.01");

    /** Units of each currency per one unit of the settlement currency. */
    private Map<String, BigDecimal> rates = new HashMap<>();

    private Duration depositTtl = Duration.ofMinutes(15);

    private BigDecimal minDeposit = new BigDecimal("100");

    private BigDecimal maxDeposit = new BigDecimal("5000000");

    private String redirectUrl;

    private Duration pendingAlertAfter = Duration.ofMinutes(30);

    private long expirySweepIntervalMs = 60000;

    /** How far back the reconciliation job looks for unpaid deposits. */
    private Duration reconciliationLookback = Duration.ofHours(48);

    private int reconciliationBatchSize = 100;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);
}
