package com.flagship.number_gateway.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.number_gateway.deposit.DepositService;
import com.flagship.number_gateway.deposit.DepositStatus;
import com.flagship.number_gateway.deposit.PaymentDeposit;
import com.flagship.number_gateway.deposit.PaymentProcessorClient;
import com.flagship.number_gateway.deposit.PaymentProcessorException;
import com.flagship.number_gateway.deposit.ProcessorVerification;
import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.error.GatewayException;
import com.flagship.number_gateway.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * User-triggered verification of a deposit against the processor, for when a webhook is late or lost.
 *
 * Converges with the webhook on the same settlement path, so the balance is credited once whichever
 * arrives first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualVerificationService {

    static final String EVENT_TYPE = "manual.verify";

    private final DepositService depositService;
    private final DepositSettlementService settlementService;
    private final PaymentProcessorClient processorClient;
    private final WebhookLogService logService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SettlementOutcome verify(String userId, String txRef) {
        PaymentDeposit deposit = depositService.getDeposit(userId, txRef);
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        long start = System.nanoTime();
        UUID logId = null;
        try {
            if (deposit.getStatus() == DepositStatus.PAID_SETTLED) {
                logId = logAttempt(deposit, null);
                finish(logId, true, true, null, start);
                return SettlementOutcome.alreadyProcessed(txRef, userId);
            }

            if (deposit.isPending() && deposit.isPastExpiry(clock.instant())) {
                depositService.expireIfOverdue(txRef);
                throw new GatewayException(ErrorCode.PAYMENT_EXPIRED,
                    "Payment session has expired. Please create a new payment.");
            }

            ProcessorVerification verification;
            try {
                verification = processorClient.verify(txRef);
            } catch (PaymentProcessorException e) {
                log.warn("Processor verification failed: txRef={}, error={}", txRef, e.getMessage());
                throw new GatewayException(ErrorCode.VERIFICATION_FAILED, e.getMessage(), e);
            }
            logId = logAttempt(deposit, verification);

            if (verification.isNotActivated()) {
                settlementService.cancelPending(txRef, "Payment not activated");
                throw new GatewayException(ErrorCode.PAYMENT_NOT_ACTIVATED,
                    "Payment was not completed. The checkout session was not activated.");
            }

            if (verification.isSuccessful()) {
                SettlementOutcome outcome = settlementService.settle(txRef, verification.getProviderTxId(),
                    verification.getAmount(), verification.getCurrency());
                if (outcome.getResult() == SettlementOutcome.Result.REJECTED) {
                    throw new GatewayException(ErrorCode.PAYMENT_FAILED,
                        "Payment received for a closed deposit and was flagged for review: " + outcome.getReason());
                }
                settlementService.notifyCommitted(outcome);
                finish(logId, true, outcome.isAlreadyProcessed(), null, start);
                return outcome;
            }

            SettlementOutcome failed = settlementService.markFailed(txRef,
                "Processor reported status " + verification.getStatus());
            settlementService.notifyCommitted(failed);
            throw new GatewayException(ErrorCode.PAYMENT_FAILED,
                "Payment " + txRef + " was not successful: " + verification.getStatus());
        } catch (GatewayException e) {
            if (logId == null) {
                logId = logAttempt(deposit, null);
            }
            finish(logId, false, false, e.getErrorCode() + ": " + e.getMessage(), start);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    private UUID logAttempt(PaymentDeposit deposit, ProcessorVerification verification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tx_ref", deposit.getTxRef());
        payload.put("deposit_status", deposit.getStatus().name());
        if (verification != null) {
            payload.put("processor_status", verification.getStatus());
            payload.put("provider_tx_id", verification.getProviderTxId());
            payload.put("amount", verification.getAmount());
            payload.put("currency", verification.getCurrency());
        }
        String raw;
        try {
            raw = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            raw = payload.toString();
        }
        String providerTxId = verification != null ? verification.getProviderTxId() : deposit.getProviderTxId();
        return logService.logReceipt(EVENT_TYPE, deposit.getTxRef(), providerTxId, raw, true,
            EVENT_TYPE + ":" + deposit.getTxRef() + ":" + providerTxId, WebhookSource.MANUAL_VERIFY);
    }

    private void finish(UUID logId, boolean processed, boolean already, String error, long start) {
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        try {
            logService.recordResult(logId, processed, already, error, latencyMs);
        } catch (RuntimeException e) {
            log.error("Failed to record verification result: logId={}", logId, e);
        }
    }
}
