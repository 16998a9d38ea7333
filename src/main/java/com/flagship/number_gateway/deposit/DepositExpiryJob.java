package com.flagship.number_gateway.deposit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Cancels deposits whose checkout expired unused and warns about deposits stuck in pending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payments.expiry-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class DepositExpiryJob {

    private static final int BATCH_SIZE = 100;

    private final DepositService depositService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${payments.expiry-sweep-interval-ms:60000}")
    public void sweep() {
        int cancelled = 0;
        for (String txRef : depositService.findOverdueReferences(BATCH_SIZE)) {
            try {
                if (depositService.expireIfOverdue(txRef).isPresent()) {
                    cancelled++;
                }
            } catch (Exception e) {
                log.warn("Failed to expire deposit {}: {}", txRef, e.getMessage());
            }
        }
        if (cancelled > 0) {
            log.info("Deposit expiry sweep cancelled {} deposits", cancelled);
        }
        alertLongPending();
    }

    void alertLongPending() {
        List<PaymentDeposit> stuck = depositService.findLongPending();
        if (stuck.isEmpty()) {
            return;
        }
        log.warn("Found {} deposits pending for more than the alert threshold", stuck.size());
        for (PaymentDeposit deposit : stuck) {
            log.warn("Pending deposit: txRef={}, userId={}, amount={} {}, pendingFor={}m",
                deposit.getTxRef(), deposit.getUserId(), deposit.getAmount(), deposit.getCurrency(),
                Duration.between(deposit.getCreatedAt(), clock.instant()).toMinutes());
        }
    }
}
