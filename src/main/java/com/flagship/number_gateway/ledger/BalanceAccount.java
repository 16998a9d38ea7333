package com.flagship.number_gateway.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's spendable balance and its running totals.
 * Never negative; created lazily on first access.
 */
@Value
public class BalanceAccount {
    String userId;
    BigDecimal balance;
    BigDecimal totalDeposited;
    BigDecimal totalSpent;
    Instant lastTransactionAt;

    public static BalanceAccount empty(String userId) {
        return new BalanceAccount(userId, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null);
    }

    public boolean canAfford(BigDecimal amount) {
        return balance.compareTo(amount) >= 0;
    }
}
