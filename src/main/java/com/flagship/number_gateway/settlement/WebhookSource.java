package com.flagship.number_gateway.settlement;

public enum WebhookSource {
    WEBHOOK,
    MANUAL_VERIFY,
    RECONCILE
}
