package com.flagship.number_gateway.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox, or already handed to Kafka.
 *
 * Written in the same transaction as the balance mutation it describes, so an event exists
 * exactly when the mutation committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // NumberPurchase or PaymentDeposit
    UUID aggregateId;
    String eventType;          // NumberPurchased, NumberRefunded, DepositSettled
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
