package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.error.GatewayException;
import com.flagship.number_gateway.notify.NotificationEvent;
import com.flagship.number_gateway.notify.Notifier;
import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.observability.GatewayMetrics;
import com.flagship.number_gateway.provider.ActivationAction;
import com.flagship.number_gateway.provider.ActivationStatus;
import com.flagship.number_gateway.provider.NumberProviderGateway;
import com.flagship.number_gateway.provider.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for everything a user does with a leased number.
 *
 * Validation and provider write calls happen outside any transaction; the ledger work is delegated to
 * {@link PurchaseLedgerService}, and notifications are sent only once that work has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseOrchestrator {

    private static final EnumSet<NumberStatus> ACTIVE = EnumSet.of(NumberStatus.WAITING, NumberStatus.RECEIVED);

    private final PurchaseLedgerService ledgerService;
    private final NumberPurchaseRepository repository;
    private final NumberProviderGateway provider;
    private final PriceCache priceCache;
    private final MarkupPolicy markupPolicy;
    private final NumbersProperties properties;
    private final Notifier notifier;
    private final GatewayMetrics metrics;
    private final Clock clock;

    /**
     * Prices, leases and pays for a number.
     *
     * @param maxPrice optional ceiling on the marked-up total
     */
    public PurchaseOutcome purchase(String userId, String service, String country, String operator,
                                    BigDecimal maxPrice) {
        BigDecimal cost = resolveCost(service, country);
        BigDecimal total = markupPolicy.priceFor(cost);
        if (maxPrice != null && total.compareTo(maxPrice) > 0) {
            throw new GatewayException(ErrorCode.PRICE_EXCEEDED,
                String.format("Price %s exceeds the maximum of %s", total, maxPrice));
        }

        PurchaseOutcome outcome;
        try {
            outcome = ledgerService.purchase(userId, service, country, operator, cost, total);
        } catch (GatewayException e) {
            if (e.getErrorCode() == ErrorCode.NO_NUMBERS_AVAILABLE || e.getErrorCode() == ErrorCode.INVALID_SERVICE) {
                priceCache.evict(service, country);
            }
            throw e;
        }
        publish(outcome);
        return outcome;
    }

    public PurchaseOutcome cancel(String userId, String activationId) {
        NumberPurchase purchase = findOwned(userId, activationId);
        if (!purchase.getStatus().isActive()) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_CANCEL,
                "Number " + activationId + " is already " + purchase.getStatus());
        }
        if (!purchase.isCancellableAt(clock.instant(), properties.getMinCancelDwell())) {
            throw new GatewayException(ErrorCode.CANCEL_TOO_EARLY,
                "Numbers can be cancelled " + properties.getMinCancelDwell().toMinutes()
                    + " minutes after purchase");
        }

        callProvider(activationId, ActivationAction.CANCEL);
        PurchaseOutcome outcome = afterProvider(activationId, ActivationAction.CANCEL,
            () -> ledgerService.cancel(activationId));
        publish(outcome);
        return outcome;
    }

    public PurchaseOutcome complete(String userId, String activationId) {
        NumberPurchase purchase = findOwned(userId, activationId);
        if (purchase.getStatus() != NumberStatus.RECEIVED) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_COMPLETE,
                "Number " + activationId + " is " + purchase.getStatus() + ", only RECEIVED numbers can be completed");
        }

        callProvider(activationId, ActivationAction.FINISH);
        PurchaseOutcome outcome = afterProvider(activationId, ActivationAction.FINISH,
            () -> ledgerService.complete(activationId));
        publish(outcome);
        return outcome;
    }

    /**
     * Asks the provider for another SMS and restarts the lease.
     */
    public PurchaseOutcome retry(String userId, String activationId) {
        NumberPurchase purchase = findOwned(userId, activationId);
        if (purchase.getStatus() != NumberStatus.WAITING) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_RETRY,
                "Number " + activationId + " is " + purchase.getStatus() + ", only WAITING numbers can be retried");
        }
        if (purchase.isPastExpiry(clock.instant())) {
            throw new GatewayException(ErrorCode.NUMBER_EXPIRED, "Number " + activationId + " has expired");
        }

        callProvider(activationId, ActivationAction.REQUEST_RETRY);
        return afterProvider(activationId, ActivationAction.REQUEST_RETRY,
            () -> ledgerService.extendLease(activationId));
    }

    /**
     * Refreshes a number from the provider. Terminal numbers are returned as stored.
     */
    public NumberPurchase syncStatus(String userId, String activationId) {
        NumberPurchase purchase = findOwned(userId, activationId);
        if (purchase.getStatus().isTerminal()) {
            return purchase;
        }
        try {
            return sync(purchase).getPurchase();
        } catch (ProviderException e) {
            throw new GatewayException(ErrorCode.forProviderError(e), e.getMessage(), e);
        }
    }

    /**
     * Background variant of {@link #syncStatus}: provider failures propagate to the caller.
     */
    public PurchaseOutcome syncActivation(String activationId) {
        NumberPurchase purchase = repository.findByActivationId(activationId)
            .map(NumberPurchaseEntity::toDomain)
            .orElseThrow(() -> new GatewayException(ErrorCode.NUMBER_NOT_FOUND, "Number not found: " + activationId));
        if (purchase.getStatus().isTerminal()) {
            return PurchaseOutcome.unchanged(purchase);
        }
        return sync(purchase);
    }

    public PurchaseOutcome expire(String activationId) {
        PurchaseOutcome outcome = ledgerService.expire(activationId);
        publish(outcome);
        return outcome;
    }

    public String getFullSms(String userId, String activationId) {
        NumberPurchase purchase = findOwned(userId, activationId);
        if (purchase.getStatus() != NumberStatus.RECEIVED) {
            throw new GatewayException(ErrorCode.SMS_NOT_RECEIVED,
                "No SMS received for number " + activationId);
        }
        if (purchase.getSmsText() != null) {
            return purchase.getSmsText();
        }
        String text;
        try {
            text = provider.getFullSms(activationId);
        } catch (ProviderException e) {
            throw new GatewayException(ErrorCode.forProviderError(e), e.getMessage(), e);
        }
        ledgerService.storeFullText(activationId, text);
        return text;
    }

    @Transactional(readOnly = true)
    public List<NumberPurchase> getActiveNumbers(String userId) {
        return repository.findByUserIdAndStatusInOrderByPurchasedAtDesc(userId, ACTIVE).stream()
            .map(NumberPurchaseEntity::toDomain)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Page<NumberPurchase> getHistory(String userId, int page, int size) {
        return repository.findByUserIdOrderByPurchasedAtDesc(userId, PageRequest.of(page, size))
            .map(NumberPurchaseEntity::toDomain);
    }

    private PurchaseOutcome sync(NumberPurchase purchase) {
        String activationId = purchase.getActivationId();
        MDC.put(CorrelationContext.ACTIVATION_ID_MDC_KEY, activationId);
        try {
            Instant now = clock.instant();
            ActivationStatus status = provider.getStatus(activationId);
            PurchaseOutcome outcome;
            if (status.hasCode() && !status.getCode().equals(purchase.getSmsCode())) {
                outcome = ledgerService.receiveCode(activationId, status.getCode());
            } else if (status.isCancelled() && purchase.getStatus() == NumberStatus.WAITING) {
                outcome = ledgerService.cancelByProvider(activationId);
            } else if (purchase.getStatus() == NumberStatus.WAITING && purchase.isPastExpiry(now)) {
                outcome = ledgerService.expire(activationId);
            } else {
                log.debug("No change for activation {}: provider state {}", activationId, status.getState());
                outcome = PurchaseOutcome.unchanged(purchase);
            }
            publish(outcome);
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.ACTIVATION_ID_MDC_KEY);
        }
    }

    private BigDecimal resolveCost(String service, String country) {
        BigDecimal cost = priceCache.get(service, country).orElse(null);
        if (cost == null) {
            try {
                cost = provider.getPrice(service, country);
            } catch (ProviderException e) {
                throw new GatewayException(ErrorCode.forProviderError(e), e.getMessage(), e);
            }
            if (cost.signum() > 0) {
                priceCache.put(service, country, cost);
            }
        }
        if (cost.signum() <= 0) {
            throw new GatewayException(ErrorCode.SERVICE_UNAVAILABLE,
                "Service " + service + " is not available in country " + country);
        }
        return cost;
    }

    private void callProvider(String activationId, ActivationAction action) {
        try {
            String reply = provider.setStatus(activationId, action);
            log.info("Provider accepted {} for activation {}: {}", action, activationId, reply);
        } catch (ProviderException e) {
            log.warn("Provider rejected {} for activation {}: kind={}, code={}",
                action, activationId, e.getKind(), e.getCode());
            throw new GatewayException(ErrorCode.forProviderError(e), e.getMessage(), e);
        }
    }

    /**
     * Runs the ledger half of a provider action that has already been accepted. A failure here leaves the
     * two sides disagreeing, so it is flagged before being rethrown.
     */
    private PurchaseOutcome afterProvider(String activationId, ActivationAction action,
                                          Supplier<PurchaseOutcome> ledgerStep) {
        try {
            return ledgerStep.get();
        } catch (RuntimeException e) {
            metrics.recordReconciliationRequired();
            log.error("RECONCILIATION_REQUIRED: provider accepted {} but the ledger update failed: activationId={}",
                action, activationId, e);
            throw e;
        }
    }

    private NumberPurchase findOwned(String userId, String activationId) {
        return repository.findByActivationIdAndUserId(activationId, userId)
            .map(NumberPurchaseEntity::toDomain)
            .orElseThrow(() -> new GatewayException(ErrorCode.NUMBER_NOT_FOUND, "Number not found: " + activationId));
    }

    private void publish(PurchaseOutcome outcome) {
        if (outcome.getNotification() == null) {
            return;
        }
        NumberPurchase purchase = outcome.getPurchase();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("activation_id", purchase.getActivationId());
        data.put("phone_number", purchase.getPhoneNumber());
        data.put("service", purchase.getServiceCode());
        data.put("status", purchase.getStatus().name());
        if (purchase.getSmsCode() != null) {
            data.put("sms_code", purchase.getSmsCode());
        }
        if (purchase.getRefundedAmount() != null) {
            data.put("refunded_amount", purchase.getRefundedAmount());
        }
        notifier.notify(purchase.getUserId(), NotificationEvent.of(outcome.getNotification(), data));

        if (outcome.movedMoney()) {
            Map<String, Object> balance = new LinkedHashMap<>();
            balance.put("balance", outcome.getBalanceAfter());
            balance.put("change", outcome.getMutation().getAmount());
            notifier.notify(purchase.getUserId(), NotificationEvent.of(NotificationEvent.BALANCE_UPDATED, balance));
        }
    }
}
