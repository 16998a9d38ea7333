package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.error.GatewayException;
import com.flagship.number_gateway.ledger.BalanceAccount;
import com.flagship.number_gateway.ledger.BalanceMutation;
import com.flagship.number_gateway.ledger.LedgerStore;
import com.flagship.number_gateway.ledger.TransactionType;
import com.flagship.number_gateway.notify.NotificationEvent;
import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.observability.GatewayMetrics;
import com.flagship.number_gateway.outbox.LedgerEvent;
import com.flagship.number_gateway.outbox.OutboxService;
import com.flagship.number_gateway.provider.ActivationLease;
import com.flagship.number_gateway.provider.NumberProviderGateway;
import com.flagship.number_gateway.provider.ProviderErrorCode;
import com.flagship.number_gateway.provider.ProviderException;
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
 * The transactional half of number orchestration: every method here is one database transaction
 * that couples a purchase row with its balance mutation, ledger record and outbox event.
 *
 * Purchase is the only method that calls the provider inside the transaction. It holds the user's
 * balance row lock across the lease so a user's purchases serialise and a failed lease debits nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseLedgerService {

    private final LedgerStore ledgerStore;
    private final NumberPurchaseRepository repository;
    private final NumberProviderGateway provider;
    private final OutboxService outboxService;
    private final RefundPolicy refundPolicy;
    private final NumbersProperties properties;
    private final GatewayMetrics metrics;
    private final Clock clock;

    /**
     * Checks the balance, leases a number and debits the user, all under the account row lock.
     *
     * @throws GatewayException INSUFFICIENT_BALANCE before any provider call, a mapped provider code
     *                          when the lease fails, or RECONCILIATION_REQUIRED when the lease succeeded
     *                          but the ledger write did not
     */
    @Transactional
    public PurchaseOutcome purchase(String userId, String service, String country, String operator,
                                    BigDecimal providerCost, BigDecimal total) {
        BalanceAccount account = ledgerStore.lockAccount(userId);
        if (!account.canAfford(total)) {
            throw new GatewayException(ErrorCode.INSUFFICIENT_BALANCE,
                String.format("Insufficient balance: required %s, available %s", total, account.getBalance()));
        }

        ActivationLease lease;
        try {
            lease = provider.leaseNumber(service, country, operator, null);
        } catch (ProviderException e) {
            metrics.recordPurchase("lease_" + e.getKind().name().toLowerCase());
            throw new GatewayException(leaseErrorCode(e), e.getMessage(), e);
        }

        MDC.put(CorrelationContext.ACTIVATION_ID_MDC_KEY, lease.getActivationId());
        try {
            Instant now = clock.instant();
            NumberPurchase purchase = NumberPurchase.create(lease.getActivationId(), userId, lease.getPhoneNumber(),
                country, service, operator, providerCost, total, now, properties.getLeaseDuration());
            repository.saveAndFlush(NumberPurchaseEntity.fromDomain(purchase));

            BalanceMutation mutation = ledgerStore.debitIfSufficient(userId, total)
                .orElseThrow(() -> new IllegalStateException(
                    "Balance changed under lock for user " + userId));

            String description = String.format("SMS Number Purchase: %s (%s) - Cost: %s, Markup: %s, Total: %s",
                service.toUpperCase(), country, providerCost, purchase.getMarkup(), total);
            ledgerStore.recordTransaction(TransactionType.PURCHASE, mutation, lease.getActivationId(), description);

            outboxService.saveEvent(OutboxService.NUMBER_PURCHASE_AGGREGATE, purchase.getId(),
                ledgerEvent(LedgerEvent.NUMBER_PURCHASED, purchase, mutation, now));

            metrics.recordPurchase("success");
            log.info("Number purchased: userId={}, activationId={}, service={}, country={}, total={}, balanceAfter={}",
                userId, lease.getActivationId(), service, country, total, mutation.getBalanceAfter());
            return new PurchaseOutcome(purchase, mutation, NotificationEvent.NUMBER_PURCHASED);
        } catch (RuntimeException e) {
            log.error("RECONCILIATION_REQUIRED: provider leased activationId={} for userId={} but the ledger write failed",
                lease.getActivationId(), userId, e);
            metrics.recordReconciliationRequired();
            throw new GatewayException(ErrorCode.RECONCILIATION_REQUIRED,
                "Number " + lease.getActivationId() + " was leased but could not be recorded", e);
        } finally {
            MDC.remove(CorrelationContext.ACTIVATION_ID_MDC_KEY);
        }
    }

    /**
     * Cancels a number the provider has already released and refunds according to the refund policy.
     * A zero refund still cancels but writes no ledger record.
     */
    @Transactional
    public PurchaseOutcome cancel(String activationId) {
        NumberPurchase purchase = lockPurchase(activationId);
        if (!purchase.getStatus().isActive()) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_CANCEL,
                "Number " + activationId + " is already " + purchase.getStatus());
        }
        Instant now = clock.instant();
        BigDecimal refund = refundPolicy.refundFor(purchase, now);
        PurchaseOutcome outcome = refund(purchase, refund, now, "Refund for cancelled number");
        metrics.recordRefund(refundPolicy.type().name());
        return outcome;
    }

    /**
     * Applies a provider-side cancellation of a waiting number. The user did not choose to cancel,
     * so the full price is returned.
     */
    @Transactional
    public PurchaseOutcome cancelByProvider(String activationId) {
        NumberPurchase purchase = lockPurchase(activationId);
        if (purchase.getStatus() != NumberStatus.WAITING) {
            return PurchaseOutcome.unchanged(purchase);
        }
        log.warn("Provider cancelled activation: activationId={}, userId={}", activationId, purchase.getUserId());
        return refund(purchase, purchase.getPrice(), clock.instant(), "Refund for provider-cancelled number");
    }

    @Transactional
    public PurchaseOutcome complete(String activationId) {
        NumberPurchase purchase = lockPurchase(activationId);
        if (purchase.getStatus() != NumberStatus.RECEIVED) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_COMPLETE,
                "Number " + activationId + " is " + purchase.getStatus() + ", only RECEIVED numbers can be completed");
        }
        NumberPurchase used = purchase.complete();
        save(used);
        metrics.recordNumberTransition(used.getStatus().name());
        return new PurchaseOutcome(used, null, NotificationEvent.NUMBER_COMPLETED);
    }

    @Transactional
    public PurchaseOutcome extendLease(String activationId) {
        NumberPurchase purchase = lockPurchase(activationId);
        if (purchase.getStatus() != NumberStatus.WAITING) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_RETRY,
                "Number " + activationId + " is " + purchase.getStatus() + ", only WAITING numbers can be retried");
        }
        NumberPurchase extended = purchase.extendLease(clock.instant(), properties.getLeaseDuration());
        save(extended);
        return PurchaseOutcome.unchanged(extended);
    }

    /**
     * Records a code reported by the provider. A repeated code changes nothing.
     */
    @Transactional
    public PurchaseOutcome receiveCode(String activationId, String code) {
        NumberPurchase purchase = lockPurchase(activationId);
        if (!purchase.getStatus().isActive() || code.equals(purchase.getSmsCode())) {
            return PurchaseOutcome.unchanged(purchase);
        }
        NumberPurchase received = purchase.receiveCode(code, clock.instant());
        save(received);
        metrics.recordNumberTransition(received.getStatus().name());
        log.info("SMS received: activationId={}, userId={}", activationId, purchase.getUserId());
        return new PurchaseOutcome(received, null, NotificationEvent.SMS_RECEIVED);
    }

    /**
     * Expires a waiting number whose lease has run out. No money moves.
     */
    @Transactional
    public PurchaseOutcome expire(String activationId) {
        NumberPurchase purchase = lockPurchase(activationId);
        Instant now = clock.instant();
        if (purchase.getStatus() != NumberStatus.WAITING || !purchase.isPastExpiry(now)) {
            return PurchaseOutcome.unchanged(purchase);
        }
        NumberPurchase expired = purchase.expire(now);
        save(expired);
        metrics.recordNumberTransition(expired.getStatus().name());
        log.info("Number expired: activationId={}, userId={}", activationId, purchase.getUserId());
        return new PurchaseOutcome(expired, null, NotificationEvent.NUMBER_EXPIRED);
    }

    @Transactional
    public NumberPurchase storeFullText(String activationId, String text) {
        NumberPurchase purchase = lockPurchase(activationId);
        NumberPurchase updated = purchase.withFullText(text);
        save(updated);
        return updated;
    }

    private PurchaseOutcome refund(NumberPurchase purchase, BigDecimal refund, Instant now, String reason) {
        NumberPurchase cancelled = purchase.cancel(refund);
        save(cancelled);
        metrics.recordNumberTransition(cancelled.getStatus().name());

        if (refund.signum() == 0) {
            log.info("Number cancelled without refund: activationId={}, userId={}",
                purchase.getActivationId(), purchase.getUserId());
            return new PurchaseOutcome(cancelled, null, NotificationEvent.NUMBER_CANCELLED);
        }

        BalanceMutation mutation = ledgerStore.credit(purchase.getUserId(), refund, TransactionType.REFUND);
        ledgerStore.recordTransaction(TransactionType.REFUND, mutation, purchase.getActivationId(),
            String.format("%s: %s (%s) %s", reason, purchase.getServiceCode().toUpperCase(),
                purchase.getCountryCode(), purchase.getPhoneNumber()));
        outboxService.saveEvent(OutboxService.NUMBER_PURCHASE_AGGREGATE, purchase.getId(),
            ledgerEvent(LedgerEvent.NUMBER_REFUNDED, cancelled, mutation, now));

        log.info("Number cancelled with refund: activationId={}, userId={}, refund={}, balanceAfter={}",
            purchase.getActivationId(), purchase.getUserId(), refund, mutation.getBalanceAfter());
        return new PurchaseOutcome(cancelled, mutation, NotificationEvent.NUMBER_CANCELLED);
    }

    private NumberPurchase lockPurchase(String activationId) {
        return repository.findByActivationIdForUpdate(activationId)
            .map(NumberPurchaseEntity::toDomain)
            .orElseThrow(() -> new GatewayException(ErrorCode.NUMBER_NOT_FOUND, "Number not found: " + activationId));
    }

    private void save(NumberPurchase purchase) {
        NumberPurchaseEntity entity = repository.findByActivationIdForUpdate(purchase.getActivationId())
            .orElseThrow(() -> new IllegalStateException("Number vanished: " + purchase.getActivationId()));
        entity.updateFromDomain(purchase);
        repository.save(entity);
    }

    private static LedgerEvent ledgerEvent(String type, NumberPurchase purchase, BalanceMutation mutation,
                                           Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activationId", purchase.getActivationId());
        details.put("phoneNumber", purchase.getPhoneNumber());
        details.put("service", purchase.getServiceCode());
        details.put("country", purchase.getCountryCode());
        details.put("providerCost", purchase.getProviderCost());
        details.put("price", purchase.getPrice());
        details.put("status", purchase.getStatus().name());
        return LedgerEvent.builder()
            .eventType(type)
            .userId(purchase.getUserId())
            .referenceId(purchase.getActivationId())
            .amount(mutation.getAmount())
            .balanceBefore(mutation.getBalanceBefore())
            .balanceAfter(mutation.getBalanceAfter())
            .details(details)
            .occurredAt(now)
            .build();
    }

    static ErrorCode leaseErrorCode(ProviderException e) {
        if (e.getCode() == ProviderErrorCode.BAD_SERVICE) {
            return ErrorCode.INVALID_SERVICE;
        }
        return switch (e.getKind()) {
            case NO_INVENTORY -> ErrorCode.NO_NUMBERS_AVAILABLE;
            case INSUFFICIENT_PROVIDER_FUNDS -> ErrorCode.PROVIDER_NO_BALANCE;
            case RATE_LIMITED -> ErrorCode.PROVIDER_RATE_LIMITED;
            case TIMEOUT -> ErrorCode.PROVIDER_TIMEOUT;
            default -> ErrorCode.PURCHASE_FAILED;
        };
    }
}
