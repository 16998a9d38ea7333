package com.flagship.number_gateway.outbox;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Payload published for every committed balance mutation.
 */
@Value
@Builder
public class LedgerEvent {

    public static final String NUMBER_PURCHASED = "NumberPurchased";
    public static final String NUMBER_REFUNDED = "NumberRefunded";
    public static final String DEPOSIT_SETTLED = "DepositSettled";

    String eventType;
    String userId;
    String referenceId;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    Map<String, Object> details;
    Instant occurredAt;
}
