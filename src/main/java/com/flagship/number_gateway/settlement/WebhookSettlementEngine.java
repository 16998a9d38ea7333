package com.flagship.number_gateway.settlement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.observability.GatewayMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Turns processor notifications into exactly-once balance credits.
 *
 * The receipt is logged and committed before anything else. After that point nothing is rethrown:
 * a processing error is written to the log entry and the delivery is still acknowledged, since a
 * redelivery would meet the same error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookSettlementEngine {

    static final String INVALID_SIGNATURE = "Invalid signature";

    private final WebhookLogService logService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final DepositSettlementService settlementService;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metrics;

    /**
     * @param rawBody request body exactly as received
     * @param signature hex HMAC-SHA512 header, may be null
     * @param verifHash processor static hash header, may be null
     * @throws RuntimeException only when the receipt itself could not be logged
     */
    public WebhookReceipt receive(byte[] rawBody, String signature, String verifHash) {
        long start = System.nanoTime();

        SettlementNotification notification;
        String parseError = null;
        try {
            notification = SettlementNotification.parse(objectMapper, rawBody);
        } catch (IllegalArgumentException e) {
            notification = SettlementNotification.unparseable();
            parseError = e.getMessage();
        }
        boolean signatureValid = signatureVerifier.verify(rawBody, signature, verifHash);
        metrics.recordWebhookReceived(notification.getEvent(), signatureValid);

        UUID webhookId = logService.logReceipt(notification.getEvent(), notification.getTxRef(),
            notification.getProviderTxId(), new String(rawBody, StandardCharsets.UTF_8), signatureValid,
            notification.idempotencyKey(), WebhookSource.WEBHOOK);

        if (notification.getTxRef() != null) {
            MDC.put(CorrelationContext.TX_REF_MDC_KEY, notification.getTxRef());
        }
        try {
            if (!signatureValid) {
                log.warn("Webhook rejected: invalid signature, webhookId={}, event={}", webhookId, notification.getEvent());
                finish(webhookId, false, false, INVALID_SIGNATURE, start);
                return new WebhookReceipt(webhookId, false, false);
            }
            if (parseError != null) {
                log.warn("Webhook body could not be parsed: webhookId={}, error={}", webhookId, parseError);
                finish(webhookId, false, false, parseError, start);
                return new WebhookReceipt(webhookId, false, false);
            }

            try {
                SettlementOutcome outcome = route(notification);
                if (outcome != null) {
                    settlementService.notifyCommitted(outcome);
                }
                boolean already = outcome != null && outcome.isAlreadyProcessed();
                finish(webhookId, true, already, null, start);
                return new WebhookReceipt(webhookId, true, already);
            } catch (Exception e) {
                log.error("Webhook processing failed: webhookId={}, event={}, txRef={}",
                    webhookId, notification.getEvent(), notification.getTxRef(), e);
                metrics.recordSettlementOutcome("error");
                finish(webhookId, false, false, e.getMessage() != null ? e.getMessage() : e.toString(), start);
                return new WebhookReceipt(webhookId, false, false);
            }
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    private SettlementOutcome route(SettlementNotification notification) {
        if (notification.isSuccessfulCharge()) {
            requireTxRef(notification);
            return settlementService.settle(notification.getTxRef(), notification.getProviderTxId(),
                notification.getAmount(), notification.getCurrency());
        }
        if (notification.isFailure()) {
            requireTxRef(notification);
            String reason = notification.getEvent()
                + (notification.getStatus() != null ? " (" + notification.getStatus() + ")" : "");
            return settlementService.markFailed(notification.getTxRef(), reason);
        }
        log.info("Webhook event acknowledged without action: event={}, status={}",
            notification.getEvent(), notification.getStatus());
        return null;
    }

    private static void requireTxRef(SettlementNotification notification) {
        if (notification.getTxRef() == null || notification.getTxRef().isBlank()) {
            throw new IllegalArgumentException("Notification " + notification.getEvent() + " has no tx_ref");
        }
    }

    private void finish(UUID webhookId, boolean processed, boolean already, String error, long start) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordSettlementDuration(elapsed);
        try {
            logService.recordResult(webhookId, processed, already, error, elapsed.toMillis());
        } catch (RuntimeException e) {
            log.error("Failed to record webhook result: webhookId={}, processed={}, error={}",
                webhookId, processed, error, e);
        }
    }
}
