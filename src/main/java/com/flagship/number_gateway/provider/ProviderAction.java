package com.flagship.number_gateway.provider;

import lombok.Getter;

/**
 * Actions understood by the number-provisioning provider, with their wire name and default lane.
 */
@Getter
public enum ProviderAction {
    GET_BALANCE("getBalance", RequestKind.READ),
    GET_PRICES("getPrices", RequestKind.READ),
    GET_STATUS("getStatus", RequestKind.READ),
    GET_FULL_SMS("getFullSms", RequestKind.READ),
    GET_NUMBER("getNumber", RequestKind.WRITE),
    SET_STATUS("setStatus", RequestKind.WRITE);

    private final String wireName;
    private final RequestKind defaultKind;

    ProviderAction(String wireName, RequestKind defaultKind) {
        this.wireName = wireName;
        this.defaultKind = defaultKind;
    }
}
