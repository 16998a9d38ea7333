package com.flagship.number_gateway.deposit;

import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.error.GatewayException;
import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.observability.GatewayMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deposit sessions: creation with an FX quote and a processor checkout, user cancellation, queries
 * and expiry. Settlement itself lives in the settlement package.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DepositService {

    private static final String REF_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final PaymentDepositRepository repository;
    private final PaymentProcessorClient processorClient;
    private final ExchangeRateProvider exchangeRateProvider;
    private final PaymentsProperties properties;
    private final GatewayMetrics metrics;
    private final Clock clock;

    /**
     * Quotes the settlement equivalent, opens a checkout and stores the pending deposit.
     */
    public PaymentDeposit createDeposit(String userId, BigDecimal amount, String currency) {
        String code = currency.toUpperCase(Locale.ROOT);
        if (amount.compareTo(properties.getMinDeposit()) < 0 || amount.compareTo(properties.getMaxDeposit()) > 0) {
            throw new GatewayException(ErrorCode.INVALID_AMOUNT, String.format(
                "Amount must be between %s and %s %s", properties.getMinDeposit(), properties.getMaxDeposit(), code));
        }

        BigDecimal rate;
        try {
            rate = exchangeRateProvider.rateFor(code);
        } catch (IllegalArgumentException e) {
            throw new GatewayException(ErrorCode.VALIDATION_FAILED, e.getMessage(), e);
        }
        BigDecimal quoted = exchangeRateProvider.toSettlement(amount, rate);

        Instant now = clock.instant();
        String txRef = PaymentDeposit.newTxRef(userId, now, randomSuffix());
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            String link;
            try {
                link = processorClient.createCheckout(txRef, userId, amount, code);
            } catch (PaymentProcessorException e) {
                log.error("Checkout creation failed: txRef={}, error={}", txRef, e.getMessage());
                throw new GatewayException(ErrorCode.DEPOSIT_CREATION_FAILED, e.getMessage(), e);
            }

            PaymentDeposit deposit = PaymentDeposit.create(txRef, userId, amount, code, quoted, rate, link,
                now, properties.getDepositTtl());
            repository.save(PaymentDepositEntity.fromDomain(deposit));
            metrics.recordDepositCreated(code);

            log.info("Deposit created: txRef={}, amount={} {}, quotedEquivalent={} {}, rate={}",
                txRef, amount, code, quoted, properties.getSettlementCurrency(), rate);
            return deposit;
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    @Transactional
    public PaymentDeposit cancelDeposit(String userId, String txRef) {
        PaymentDepositEntity entity = repository.findByTxRefForUpdate(txRef)
            .filter(d -> d.getUserId().equals(userId))
            .orElseThrow(() -> new GatewayException(ErrorCode.DEPOSIT_NOT_FOUND, "Deposit not found: " + txRef));
        PaymentDeposit deposit = entity.toDomain();
        if (!deposit.isPending()) {
            throw new GatewayException(ErrorCode.INVALID_STATUS_FOR_CANCELLATION,
                "Deposit " + txRef + " is already " + deposit.getStatus());
        }
        PaymentDeposit cancelled = deposit.cancel("Cancelled by user");
        entity.updateFromDomain(cancelled);
        repository.save(entity);
        log.info("Deposit cancelled by user: txRef={}, userId={}", txRef, userId);
        return cancelled;
    }

    /**
     * Cancels the deposit if it is still pending past its expiry.
     *
     * @return the cancelled deposit, or empty when nothing changed
     */
    @Transactional
    public Optional<PaymentDeposit> expireIfOverdue(String txRef) {
        PaymentDepositEntity entity = repository.findByTxRefForUpdate(txRef)
            .orElseThrow(() -> new GatewayException(ErrorCode.DEPOSIT_NOT_FOUND, "Deposit not found: " + txRef));
        PaymentDeposit deposit = entity.toDomain();
        if (!deposit.isPending() || !deposit.isPastExpiry(clock.instant())) {
            return Optional.empty();
        }
        PaymentDeposit cancelled = deposit.cancel("Payment session expired");
        entity.updateFromDomain(cancelled);
        repository.save(entity);
        log.info("Expired deposit cancelled: txRef={}, userId={}", txRef, deposit.getUserId());
        return Optional.of(cancelled);
    }

    @Transactional(readOnly = true)
    public PaymentDeposit getDeposit(String userId, String txRef) {
        return repository.findByTxRefAndUserId(txRef, userId)
            .map(PaymentDepositEntity::toDomain)
            .orElseThrow(() -> new GatewayException(ErrorCode.DEPOSIT_NOT_FOUND, "Deposit not found: " + txRef));
    }

    @Transactional(readOnly = true)
    public Page<PaymentDeposit> listDeposits(String userId, int page, int size) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(page, size))
            .map(PaymentDepositEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<String> findOverdueReferences(int limit) {
        return repository.findByStatusAndExpiresAtBefore(DepositStatus.PENDING_UNSETTLED, clock.instant(),
                PageRequest.of(0, limit)).stream()
            .map(PaymentDepositEntity::getTxRef)
            .collect(Collectors.toList());
    }

    /**
     * References of unpaid deposits created within the reconciliation lookback, oldest first.
     * Cancelled deposits are included because their checkout link may still have been paid.
     */
    @Transactional(readOnly = true)
    public List<String> findReconciliationCandidates(int limit) {
        Instant cutoff = clock.instant().minus(properties.getReconciliationLookback());
        return repository.findByStatusInAndCreatedAtAfterOrderByCreatedAtAsc(
                EnumSet.of(DepositStatus.PENDING_UNSETTLED, DepositStatus.CANCELLED), cutoff,
                PageRequest.of(0, limit)).stream()
            .map(PaymentDepositEntity::getTxRef)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<PaymentDeposit> findLongPending() {
        Instant cutoff = clock.instant().minus(properties.getPendingAlertAfter());
        return repository.findByStatusAndCreatedAtBefore(DepositStatus.PENDING_UNSETTLED, cutoff).stream()
            .map(PaymentDepositEntity::toDomain)
            .collect(Collectors.toList());
    }

    static String randomSuffix() {
        StringBuilder sb = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            sb.append(REF_ALPHABET.charAt(RANDOM.nextInt(REF_ALPHABET.length())));
        }
        return sb.toString();
    }
}
