package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.provider.ProviderErrorCode;
import com.flagship.number_gateway.provider.ProviderException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LeaseErrorCodeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "NO_NUMBERS, NO_NUMBERS_AVAILABLE",
            "NO_BALANCE, PROVIDER_NO_BALANCE",
            "BAD_SERVICE, INVALID_SERVICE",
            "TOO_MANY_REQUESTS, PROVIDER_RATE_LIMITED",
            "HTTP_429, PROVIDER_RATE_LIMITED",
            "TRANSPORT_TIMEOUT, PROVIDER_TIMEOUT",
            "ERROR_SQL, PURCHASE_FAILED",
            "BAD_KEY, PURCHASE_FAILED",
    })
    void mapsLeaseFailures(ProviderErrorCode providerCode, ErrorCode expected) {
        ProviderException failure = new ProviderException(providerCode, "lease failed");

        assertEquals(expected, PurchaseLedgerService.leaseErrorCode(failure));
    }
}
