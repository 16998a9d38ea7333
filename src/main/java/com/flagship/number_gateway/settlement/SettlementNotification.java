package com.flagship.number_gateway.settlement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * The fields of a processor notification that settlement acts on.
 *
 * Shape: {@code {"event": "...", "data": {"id": ..., "tx_ref": "...", "status": "...", "amount": ..., "currency": "..."}}}
 */
@Value
public class SettlementNotification {

    public static final String CHARGE_COMPLETED = "charge.completed";
    public static final String UNPARSEABLE = "unparseable";

    String event;
    String txRef;
    String providerTxId;
    String status;
    BigDecimal amount;
    String currency;

    public static SettlementNotification parse(ObjectMapper objectMapper, byte[] rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Webhook body is not a JSON object");
        }
        JsonNode data = root.path("data");
        return new SettlementNotification(
            text(root, "event", UNPARSEABLE),
            text(data, "tx_ref", null),
            text(data, "id", null),
            text(data, "status", null),
            amount(data.get("amount")),
            text(data, "currency", null)
        );
    }

    public static SettlementNotification unparseable() {
        return new SettlementNotification(UNPARSEABLE, null, null, null, null, null);
    }

    /**
     * Stable key for one delivery: {@code event:txRef:providerTxId}.
     */
    public String idempotencyKey() {
        return event + ":" + txRef + ":" + providerTxId;
    }

    public boolean isSuccessfulCharge() {
        return CHARGE_COMPLETED.equals(event) && "successful".equalsIgnoreCase(status);
    }

    /**
     * A completed charge that failed or was cancelled, or any reversal or failure event.
     */
    public boolean isFailure() {
        if (CHARGE_COMPLETED.equals(event)) {
            String s = status != null ? status.toLowerCase(Locale.ROOT) : "";
            return s.equals("failed") || s.equals("cancelled");
        }
        return event.endsWith(".reversed") || event.endsWith(".failed");
    }

    private static BigDecimal amount(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Webhook amount is not a number: " + value.asText(), e);
            }
        }
        throw new IllegalArgumentException("Webhook amount has unsupported type " + value.getNodeType());
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }
}
