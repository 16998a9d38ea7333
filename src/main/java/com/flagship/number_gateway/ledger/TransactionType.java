package com.flagship.number_gateway.ledger;

public enum TransactionType {
    DEPOSIT,
    PURCHASE,
    REFUND
}
