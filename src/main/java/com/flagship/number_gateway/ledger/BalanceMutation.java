package com.flagship.number_gateway.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of one atomic balance update. Both sides come from the same UPDATE ... RETURNING statement.
 */
@Value
public class BalanceMutation {
    String userId;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
}
