package com.flagship.number_gateway.numbers;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns the provider's unit cost into the price charged to the user.
 */
@Component
@RequiredArgsConstructor
public class MarkupPolicy {

    static final int SCALE = 4;

    private final NumbersProperties properties;

    public BigDecimal priceFor(BigDecimal providerCost) {
        if (providerCost == null || providerCost.signum() <= 0) {
            throw new IllegalArgumentException("Provider cost must be positive: " + providerCost);
        }
        return providerCost.multiply(properties.getMarkupMultiplier()).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
