package com.flagship.number_gateway.settlement;

import com.flagship.number_gateway.deposit.ExchangeRateProvider;
import com.flagship.number_gateway.deposit.PaymentDeposit;
import com.flagship.number_gateway.deposit.PaymentDepositEntity;
import com.flagship.number_gateway.deposit.PaymentDepositRepository;
import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.error.GatewayException;
import com.flagship.number_gateway.ledger.BalanceMutation;
import com.flagship.number_gateway.ledger.LedgerStore;
import com.flagship.number_gateway.ledger.TransactionType;
import com.flagship.number_gateway.notify.NotificationEvent;
import com.flagship.number_gateway.notify.Notifier;
import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.observability.GatewayMetrics;
import com.flagship.number_gateway.outbox.LedgerEvent;
import com.flagship.number_gateway.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single settlement path shared by webhooks and manual verification.
 *
 * Every method locks the deposit row first, so concurrent deliveries for one reference serialise and
 * exactly one of them can move the deposit to PAID_SETTLED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DepositSettlementService {

    private final PaymentDepositRepository depositRepository;
    private final LedgerStore ledgerStore;
    private final OutboxService outboxService;
    private final ExchangeRateProvider exchangeRateProvider;
    private final Notifier notifier;
    private final GatewayMetrics metrics;
    private final Clock clock;

    /**
     * Settles a confirmed payment: marks the deposit paid, credits the balance, appends the ledger
     * record and writes the outbox event, all in one transaction.
     *
     * @param paidAmount amount the processor reports, or null to use the requested amount
     * @param paidCurrency currency the processor reports, or null to use the requested currency
     * @throws GatewayException DEPOSIT_NOT_FOUND for an unknown reference
     */
    @Transactional
    public SettlementOutcome settle(String txRef, String providerTxId, BigDecimal paidAmount, String paidCurrency) {
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            PaymentDepositEntity entity = lock(txRef);
            PaymentDeposit deposit = entity.toDomain();

            switch (deposit.getStatus()) {
                case PAID_SETTLED -> {
                    log.info("Deposit already settled, nothing to do: txRef={}", txRef);
                    metrics.recordSettlementOutcome("already_processed");
                    return SettlementOutcome.alreadyProcessed(txRef, deposit.getUserId());
                }
                case FAILED -> {
                    log.warn("Payment confirmed for a FAILED deposit, needs operator review: txRef={}, userId={}, "
                        + "providerTxId={}, amount={} {}", txRef, deposit.getUserId(), providerTxId, paidAmount,
                        paidCurrency);
                    metrics.recordSettlementOutcome("rejected");
                    return SettlementOutcome.of(SettlementOutcome.Result.REJECTED, txRef, deposit.getUserId(),
                        "Deposit is " + deposit.getStatus());
                }
                case CANCELLED -> log.warn("Payment confirmed for a cancelled deposit, settling anyway: txRef={}, "
                    + "userId={}, reason={}", txRef, deposit.getUserId(), deposit.getFailureReason());
                case PENDING_UNSETTLED -> {
                }
            }

            BigDecimal amount = paidAmount != null ? paidAmount : deposit.getAmount();
            String currency = paidCurrency != null ? paidCurrency : deposit.getCurrency();
            BigDecimal rate = exchangeRateProvider.rateFor(currency);
            BigDecimal equivalent = exchangeRateProvider.toSettlement(amount, rate);
            if (equivalent.signum() <= 0) {
                throw new GatewayException(ErrorCode.INVALID_AMOUNT,
                    "Settlement of " + txRef + " converts to a non-positive amount: " + equivalent);
            }

            Instant now = clock.instant();
            PaymentDeposit settled = deposit.settle(providerTxId, amount, rate, equivalent, now);
            entity.updateFromDomain(settled);
            depositRepository.save(entity);

            BalanceMutation mutation = ledgerStore.credit(deposit.getUserId(), equivalent, TransactionType.DEPOSIT);
            ledgerStore.recordTransaction(TransactionType.DEPOSIT, mutation, txRef,
                String.format("Deposit: %s %s @ %s", amount, currency, rate));
            outboxService.saveEvent(OutboxService.PAYMENT_DEPOSIT_AGGREGATE, deposit.getId(),
                depositSettledEvent(settled, mutation, now));

            metrics.recordSettlementOutcome("settled");
            log.info("Deposit settled: txRef={}, userId={}, paid={} {}, credited={}, balanceAfter={}",
                txRef, deposit.getUserId(), amount, currency, equivalent, mutation.getBalanceAfter());
            return SettlementOutcome.settled(txRef, deposit.getUserId(), equivalent, mutation.getBalanceAfter());
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Marks a pending deposit FAILED. The balance is never touched.
     */
    @Transactional
    public SettlementOutcome markFailed(String txRef, String reason) {
        PaymentDepositEntity entity = lock(txRef);
        PaymentDeposit deposit = entity.toDomain();
        if (!deposit.isPending()) {
            log.warn("Failure notification for a {} deposit ignored: txRef={}, reason={}",
                deposit.getStatus(), txRef, reason);
            return SettlementOutcome.of(SettlementOutcome.Result.IGNORED, txRef, deposit.getUserId(),
                "Deposit is " + deposit.getStatus());
        }
        entity.updateFromDomain(deposit.fail(reason));
        depositRepository.save(entity);
        metrics.recordSettlementOutcome("failed");
        log.info("Deposit marked failed: txRef={}, userId={}, reason={}", txRef, deposit.getUserId(), reason);
        return SettlementOutcome.of(SettlementOutcome.Result.MARKED_FAILED, txRef, deposit.getUserId(), reason);
    }

    /**
     * Cancels a pending deposit whose checkout was never started.
     */
    @Transactional
    public SettlementOutcome cancelPending(String txRef, String reason) {
        PaymentDepositEntity entity = lock(txRef);
        PaymentDeposit deposit = entity.toDomain();
        if (!deposit.isPending()) {
            return SettlementOutcome.of(SettlementOutcome.Result.IGNORED, txRef, deposit.getUserId(),
                "Deposit is " + deposit.getStatus());
        }
        entity.updateFromDomain(deposit.cancel(reason));
        depositRepository.save(entity);
        log.info("Deposit cancelled: txRef={}, userId={}, reason={}", txRef, deposit.getUserId(), reason);
        return SettlementOutcome.of(SettlementOutcome.Result.CANCELLED, txRef, deposit.getUserId(), reason);
    }

    /**
     * Pushes the user-facing notifications for a committed outcome. Never throws.
     */
    public void notifyCommitted(SettlementOutcome outcome) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tx_ref", outcome.getTxRef());
        switch (outcome.getResult()) {
            case SETTLED -> {
                data.put("amount", outcome.getAmountCredited());
                data.put("balance", outcome.getBalanceAfter());
                notifier.notify(outcome.getUserId(), NotificationEvent.of(NotificationEvent.DEPOSIT_SETTLED, data));
                Map<String, Object> balance = new LinkedHashMap<>();
                balance.put("balance", outcome.getBalanceAfter());
                balance.put("change", outcome.getAmountCredited());
                notifier.notify(outcome.getUserId(), NotificationEvent.of(NotificationEvent.BALANCE_UPDATED, balance));
            }
            case MARKED_FAILED -> {
                data.put("reason", outcome.getReason());
                notifier.notify(outcome.getUserId(), NotificationEvent.of(NotificationEvent.DEPOSIT_FAILED, data));
            }
            default -> {
            }
        }
    }

    private PaymentDepositEntity lock(String txRef) {
        return depositRepository.findByTxRefForUpdate(txRef)
            .orElseThrow(() -> new GatewayException(ErrorCode.DEPOSIT_NOT_FOUND, "Deposit not found: " + txRef));
    }

    private static LedgerEvent depositSettledEvent(PaymentDeposit deposit, BalanceMutation mutation, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("txRef", deposit.getTxRef());
        details.put("providerTxId", deposit.getProviderTxId());
        details.put("paidAmount", deposit.getSettledAmount());
        details.put("currency", deposit.getCurrency());
        details.put("exchangeRate", deposit.getExchangeRate());
        return LedgerEvent.builder()
            .eventType(LedgerEvent.DEPOSIT_SETTLED)
            .userId(deposit.getUserId())
            .referenceId(deposit.getTxRef())
            .amount(mutation.getAmount())
            .balanceBefore(mutation.getBalanceBefore())
            .balanceAfter(mutation.getBalanceAfter())
            .details(details)
            .occurredAt(now)
            .build();
    }
}
