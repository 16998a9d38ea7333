package com.flagship.number_gateway.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.number_gateway.deposit.DepositService;
import com.flagship.number_gateway.deposit.PaymentProcessorClient;
import com.flagship.number_gateway.deposit.PaymentsProperties;
import com.flagship.number_gateway.deposit.ProcessorVerification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Re-verifies unpaid deposits with the processor and settles the ones that were paid.
 *
 * Covers lost webhooks and payments made after a session was cancelled. Only successful payments are acted
 * on; every other processor answer leaves the deposit as it is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payments.reconciliation-enabled", havingValue = "true", matchIfMissing = true)
public class DepositReconciliationJob {

    static final String EVENT_TYPE = "reconcile.verify";

    private final DepositService depositService;
    private final PaymentProcessorClient processorClient;
    private final DepositSettlementService settlementService;
    private final WebhookLogService logService;
    private final PaymentsProperties properties;
    private final ObjectMapper objectMapper;

    @Scheduled(initialDelayString = "${payments.reconciliation-initial-delay-ms:60000}",
        fixedDelayString = "${payments.reconciliation-interval-ms:10800000}")
    public void run() {
        reconcile();
    }

    /**
     * @return number of deposits settled by this pass
     */
    public int reconcile() {
        int settled = 0;
        int checked = 0;
        for (String txRef : depositService.findReconciliationCandidates(properties.getReconciliationBatchSize())) {
            checked++;
            try {
                if (reconcileOne(txRef)) {
                    settled++;
                }
            } catch (RuntimeException e) {
                log.warn("Reconciliation of deposit {} failed: {}", txRef, e.getMessage());
            }
        }
        if (checked > 0) {
            log.info("Deposit reconciliation checked {} deposits, settled {}", checked, settled);
        }
        return settled;
    }

    private boolean reconcileOne(String txRef) {
        ProcessorVerification verification = processorClient.verify(txRef);
        if (!verification.isSuccessful()) {
            log.debug("Nothing to reconcile for {}: processor status={}", txRef, verification.getStatus());
            return false;
        }

        long start = System.nanoTime();
        UUID logId = logService.logReceipt(EVENT_TYPE, txRef, verification.getProviderTxId(),
            rawPayload(txRef, verification), true,
            EVENT_TYPE + ":" + txRef + ":" + verification.getProviderTxId(), WebhookSource.RECONCILE);
        try {
            SettlementOutcome outcome = settlementService.settle(txRef, verification.getProviderTxId(),
                verification.getAmount(), verification.getCurrency());
            settlementService.notifyCommitted(outcome);
            boolean rejected = outcome.getResult() == SettlementOutcome.Result.REJECTED;
            logService.recordResult(logId, !rejected, outcome.isAlreadyProcessed(),
                rejected ? outcome.getReason() : null, (System.nanoTime() - start) / 1_000_000);
            if (outcome.isSettled()) {
                log.info("Reconciled deposit {}: userId={}, credited={}", txRef, outcome.getUserId(),
                    outcome.getAmountCredited());
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            logService.recordResult(logId, false, false, e.getMessage(), (System.nanoTime() - start) / 1_000_000);
            throw e;
        }
    }

    private String rawPayload(String txRef, ProcessorVerification verification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tx_ref", txRef);
        payload.put("processor_status", verification.getStatus());
        payload.put("provider_tx_id", verification.getProviderTxId());
        payload.put("amount", verification.getAmount());
        payload.put("currency", verification.getCurrency());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }
}
