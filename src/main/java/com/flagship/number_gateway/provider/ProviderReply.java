package com.flagship.number_gateway.provider;

import lombok.Value;

/**
 * A successful provider response body, already screened for error tokens.
 */
@Value
public class ProviderReply {
    ProviderAction action;
    String body;
}
