package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.ledger.BalanceMutation;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a committed number operation: the purchase as stored and, when money moved, the balance change.
 */
@Value
public class PurchaseOutcome {
    NumberPurchase purchase;
    BalanceMutation mutation;
    String notification;

    public static PurchaseOutcome unchanged(NumberPurchase purchase) {
        return new PurchaseOutcome(purchase, null, null);
    }

    public boolean movedMoney() {
        return mutation != null;
    }

    public BigDecimal getBalanceAfter() {
        return mutation != null ? mutation.getBalanceAfter() : null;
    }
}
