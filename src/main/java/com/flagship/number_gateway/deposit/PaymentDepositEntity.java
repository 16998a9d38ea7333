package com.flagship.number_gateway.deposit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payment_deposits. Mutable columns change only through {@link #updateFromDomain}.
 */
@Entity
@Table(name = "payment_deposits")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentDepositEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tx_ref", nullable = false, unique = true, updatable = false)
    private String txRef;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "provider_tx_id")
    private String providerTxId;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "settlement_equivalent", precision = 19, scale = 4)
    private BigDecimal settlementEquivalent;

    @Column(name = "exchange_rate", precision = 19, scale = 6)
    private BigDecimal exchangeRate;

    @Column(name = "settled_amount", precision = 19, scale = 4)
    private BigDecimal settledAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DepositStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "payment_link", updatable = false)
    private String paymentLink;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentDepositEntity fromDomain(PaymentDeposit deposit) {
        return new PaymentDepositEntity(
            deposit.getId(),
            deposit.getTxRef(),
            deposit.getUserId(),
            deposit.getProviderTxId(),
            deposit.getAmount(),
            deposit.getCurrency(),
            deposit.getSettlementEquivalent(),
            deposit.getExchangeRate(),
            deposit.getSettledAmount(),
            deposit.getStatus(),
            deposit.getFailureReason(),
            deposit.getPaymentLink(),
            deposit.getExpiresAt(),
            deposit.getPaidAt(),
            deposit.getCreatedAt(),
            null
        );
    }

    public PaymentDeposit toDomain() {
        return new PaymentDeposit(
            id,
            txRef,
            userId,
            providerTxId,
            amount,
            currency,
            settlementEquivalent,
            exchangeRate,
            settledAmount,
            status,
            failureReason,
            paymentLink,
            expiresAt,
            paidAt,
            createdAt
        );
    }

    public void updateFromDomain(PaymentDeposit deposit) {
        this.providerTxId = deposit.getProviderTxId();
        this.settlementEquivalent = deposit.getSettlementEquivalent();
        this.exchangeRate = deposit.getExchangeRate();
        this.settledAmount = deposit.getSettledAmount();
        this.status = deposit.getStatus();
        this.failureReason = deposit.getFailureReason();
        this.paidAt = deposit.getPaidAt();
    }
}
