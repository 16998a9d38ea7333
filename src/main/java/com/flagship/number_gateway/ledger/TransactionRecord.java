package com.flagship.number_gateway.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable, append-only ledger row.
 * At most one record exists per (type, referenceId).
 */
@Value
public class TransactionRecord {
    UUID id;
    String userId;
    TransactionType type;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    String referenceId;
    String description;
    String status;
    Instant createdAt;
}
