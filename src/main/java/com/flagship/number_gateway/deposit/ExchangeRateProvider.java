package com.flagship.number_gateway.deposit;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Source of conversion rates into the settlement currency.
 */
public interface ExchangeRateProvider {

    int EQUIVALENT_SCALE = 4;

    /**
     * @return units of {@code currency} per one unit of the settlement currency; 1 for the settlement currency
     * @throws IllegalArgumentException for an unsupported currency
     */
    BigDecimal rateFor(String currency);

    default BigDecimal toSettlement(BigDecimal amount, BigDecimal rate) {
        return amount.divide(rate, EQUIVALENT_SCALE, RoundingMode.HALF_DOWN);
    }
}
