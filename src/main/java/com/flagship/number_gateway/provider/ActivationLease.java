package com.flagship.number_gateway.provider;

import lombok.Value;

/**
 * A number leased from the provider: its activation id and the phone number.
 */
@Value
public class ActivationLease {
    String activationId;
    String phoneNumber;
}
