package com.flagship.number_gateway.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.ledger.BalanceAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("total_deposited")
    BigDecimal totalDeposited;

    @JsonProperty("total_spent")
    BigDecimal totalSpent;

    @JsonProperty("last_transaction_at")
    Instant lastTransactionAt;

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    public static BalanceResponse from(BalanceAccount account, List<TransactionResponse> transactions) {
        return BalanceResponse.builder()
            .userId(account.getUserId())
            .balance(account.getBalance())
            .totalDeposited(account.getTotalDeposited())
            .totalSpent(account.getTotalSpent())
            .lastTransactionAt(account.getLastTransactionAt())
            .transactions(transactions)
            .build();
    }
}
