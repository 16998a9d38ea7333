package com.flagship.number_gateway.deposit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredExchangeRateProviderTest {

    private ConfiguredExchangeRateProvider rates;

    @BeforeEach
    void setUp() {
        PaymentsProperties properties = new PaymentsProperties();
        properties.getRates().put("NGN", new BigDecimal("1550"));
        rates = new ConfiguredExchangeRateProvider(properties);
    }

    @Test
    void settlementCurrencyIsParity() {
        assertEquals(BigDecimal.ONE, rates.rateFor("usd"));
    }

    @Test
    void appliesMarginToConfiguredRate() {
        // 1550 x 1.01
        assertEquals(new BigDecimal("1565.500000"), rates.rateFor("NGN"));
    }

    @Test
    void convertsIntoSettlementCurrency() {
        BigDecimal rate = rates.rateFor("NGN");

        assertEquals(new BigDecimal("9.9010"), rates.toSettlement(new BigDecimal("15500"), rate));
    }

    @Test
    void rejectsUnknownCurrency() {
        assertThrows(IllegalArgumentException.class, () -> rates.rateFor("EUR"));
    }
}
