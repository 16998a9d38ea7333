package com.flagship.number_gateway.deposit;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Rates from {@code payments.rates}, widened by {@code payments.fx-margin}.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredExchangeRateProvider implements ExchangeRateProvider {

    private static final int RATE_SCALE = 6;

    private final PaymentsProperties properties;

    @Override
    public BigDecimal rateFor(String currency) {
        String code = currency.toUpperCase(Locale.ROOT);
        if (code.equals(properties.getSettlementCurrency())) {
            return BigDecimal.ONE;
        }
        BigDecimal base = properties.getRates().get(code);
        if (base == null || base.signum() <= 0) {
            throw new IllegalArgumentException("Unsupported currency: " + currency);
        }
        return base.multiply(BigDecimal.ONE.add(properties.getFxMargin())).setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }
}
