package com.flagship.number_gateway.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.ledger.TransactionRecord;
import com.flagship.number_gateway.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balance_before")
    BigDecimal balanceBefore;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    String status;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(TransactionRecord record) {
        return TransactionResponse.builder()
            .id(record.getId())
            .type(record.getType())
            .amount(record.getAmount())
            .balanceBefore(record.getBalanceBefore())
            .balanceAfter(record.getBalanceAfter())
            .referenceId(record.getReferenceId())
            .description(record.getDescription())
            .status(record.getStatus())
            .createdAt(record.getCreatedAt())
            .build();
    }
}
