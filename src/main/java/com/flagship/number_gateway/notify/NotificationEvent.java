package com.flagship.number_gateway.notify;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A state change pushed to the user's client.
 */
@Value
public class NotificationEvent {

    public static final String NUMBER_PURCHASED = "number_purchased";
    public static final String NUMBER_CANCELLED = "number_cancelled";
    public static final String NUMBER_COMPLETED = "number_completed";
    public static final String NUMBER_EXPIRED = "number_expired";
    public static final String SMS_RECEIVED = "sms_received";
    public static final String BALANCE_UPDATED = "balance_updated";
    public static final String DEPOSIT_SETTLED = "deposit_settled";
    public static final String DEPOSIT_FAILED = "deposit_failed";

    String type;
    Map<String, Object> data;
    Instant occurredAt;

    public static NotificationEvent of(String type, Map<String, Object> data) {
        return new NotificationEvent(type, data, Instant.now());
    }
}
