package com.flagship.number_gateway.numbers;

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
 * JPA entity for number_purchases.
 *
 * No setters: state changes go through {@link NumberPurchase} and are copied back with
 * {@link #updateFromDomain}, which only touches the mutable columns.
 */
@Entity
@Table(name = "number_purchases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NumberPurchaseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "activation_id", nullable = false, unique = true, updatable = false)
    private String activationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "phone_number", nullable = false, updatable = false)
    private String phoneNumber;

    @Column(name = "country_code", nullable = false, updatable = false)
    private String countryCode;

    @Column(name = "service_code", nullable = false, updatable = false)
    private String serviceCode;

    @Column(name = "operator", updatable = false)
    private String operator;

    @Column(name = "provider_cost", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal providerCost;

    @Column(name = "price", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NumberStatus status;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private Instant purchasedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "sms_code")
    private String smsCode;

    @Column(name = "sms_text", columnDefinition = "TEXT")
    private String smsText;

    @Column(name = "received_at")
    private Instant receivedAt;

    @Column(name = "refunded_amount", precision = 19, scale = 4)
    private BigDecimal refundedAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static NumberPurchaseEntity fromDomain(NumberPurchase purchase) {
        return new NumberPurchaseEntity(
            purchase.getId(),
            purchase.getActivationId(),
            purchase.getUserId(),
            purchase.getPhoneNumber(),
            purchase.getCountryCode(),
            purchase.getServiceCode(),
            purchase.getOperator(),
            purchase.getProviderCost(),
            purchase.getPrice(),
            purchase.getStatus(),
            purchase.getPurchasedAt(),
            purchase.getExpiresAt(),
            purchase.getSmsCode(),
            purchase.getSmsText(),
            purchase.getReceivedAt(),
            purchase.getRefundedAmount(),
            null, // set by @PrePersist
            null
        );
    }

    public NumberPurchase toDomain() {
        return new NumberPurchase(
            id,
            activationId,
            userId,
            phoneNumber,
            countryCode,
            serviceCode,
            operator,
            providerCost,
            price,
            status,
            purchasedAt,
            expiresAt,
            smsCode,
            smsText,
            receivedAt,
            refundedAmount
        );
    }

    void updateFromDomain(NumberPurchase purchase) {
        this.status = purchase.getStatus();
        this.expiresAt = purchase.getExpiresAt();
        this.smsCode = purchase.getSmsCode();
        this.smsText = purchase.getSmsText();
        this.receivedAt = purchase.getReceivedAt();
        this.refundedAmount = purchase.getRefundedAmount();
    }
}
