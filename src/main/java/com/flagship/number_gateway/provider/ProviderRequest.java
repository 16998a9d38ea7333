package com.flagship.number_gateway.provider;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One provider call: action, ordered parameters and the lane it runs on.
 */
@Value
public class ProviderRequest {
    ProviderAction action;
    Map<String, String> params;
    RequestKind kind;

    public ProviderRequest(ProviderAction action, Map<String, String> params, RequestKind kind) {
        if (action == null) {
            throw new IllegalArgumentException("Provider action is required");
        }
        this.action = action;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params == null ? Map.of() : params));
        this.kind = kind != null ? kind : action.getDefaultKind();
    }

    public static ProviderRequest of(ProviderAction action, Map<String, String> params) {
        return new ProviderRequest(action, params, action.getDefaultKind());
    }

    public static ProviderRequest of(ProviderAction action) {
        return new ProviderRequest(action, Map.of(), action.getDefaultKind());
    }

    /**
     * Builder for ordered parameters; null values are skipped.
     */
    public static Params params() {
        return new Params();
    }

    public static final class Params {
        private final Map<String, String> values = new LinkedHashMap<>();

        public Params put(String name, Object value) {
            if (value != null && !value.toString().isBlank()) {
                values.put(name, value.toString());
            }
            return this;
        }

        public Map<String, String> build() {
            return values;
        }
    }
}
