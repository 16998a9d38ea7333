package com.flagship.number_gateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ProviderResponseCodecTest {

    private final ProviderResponseCodec codec = new ProviderResponseCodec(new ObjectMapper());

    @Nested
    @DisplayName("Error screening")
    class Screening {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "NO_NUMBERS, NO_INVENTORY",
                "NO_BALANCE, INSUFFICIENT_PROVIDER_FUNDS",
                "BAD_SERVICE, INVALID_REQUEST",
                "BAD_KEY, INVALID_REQUEST",
                "TOO_MANY_REQUESTS, RATE_LIMITED",
                "ERROR_SQL, UPSTREAM",
                "WRONG_ACTIVATION_ID, INVALID_REQUEST",
        })
        @DisplayName("Known tokens map to their error kind")
        void knownTokens(String token, ProviderErrorKind kind) {
            ProviderException e = assertThrows(ProviderException.class,
                    () -> codec.screen(ProviderAction.GET_NUMBER, token));
            assertEquals(kind, e.getKind());
            assertEquals(ProviderErrorCode.valueOf(token), e.getCode());
        }

        @Test
        @DisplayName("A token followed by ':' details is still recognised")
        void tokenWithDetails() {
            ProviderException e = assertThrows(ProviderException.class,
                    () -> codec.screen(ProviderAction.GET_NUMBER, "BAD_STATUS:activation closed"));
            assertEquals(ProviderErrorCode.BAD_STATUS, e.getCode());
        }

        @Test
        @DisplayName("Unknown ERROR text becomes an upstream failure")
        void unknownError() {
            ProviderException e = assertThrows(ProviderException.class,
                    () -> codec.screen(ProviderAction.GET_STATUS, "ERROR_SOMETHING_NEW"));
            assertEquals(ProviderErrorCode.UNKNOWN, e.getCode());
            assertEquals(ProviderErrorKind.UPSTREAM, e.getKind());
        }

        @Test
        @DisplayName("An empty body is unexpected")
        void emptyBody() {
            ProviderException e = assertThrows(ProviderException.class,
                    () -> codec.screen(ProviderAction.GET_STATUS, "  "));
            assertEquals(ProviderErrorCode.UNEXPECTED_RESPONSE, e.getCode());
        }

        @Test
        @DisplayName("Success bodies are returned trimmed")
        void successPassesThrough() {
            assertEquals("ACCESS_NUMBER:1:2", codec.screen(ProviderAction.GET_NUMBER, " ACCESS_NUMBER:1:2\n"));
        }

        @Test
        @DisplayName("A token must match whole, not as a prefix of another word")
        void prefixIsNotAToken() {
            assertEquals("NO_NUMBERSX", codec.screen(ProviderAction.GET_NUMBER, "NO_NUMBERSX"));
        }
    }

    @Nested
    @DisplayName("Success parsing")
    class Parsing {

        @Test
        void parsesLease() {
            ActivationLease lease = codec.parseLease("ACCESS_NUMBER:987654:79001234567");
            assertEquals("987654", lease.getActivationId());
            assertEquals("79001234567", lease.getPhoneNumber());
        }

        @Test
        void rejectsMalformedLease() {
            assertThrows(ProviderException.class, () -> codec.parseLease("ACCESS_NUMBER:987654"));
            assertThrows(ProviderException.class, () -> codec.parseLease("ACCESS_READY"));
        }

        @Test
        void parsesStatusWithCode() {
            ActivationStatus status = codec.parseStatus("STATUS_OK:48213");
            assertEquals(ActivationStatus.State.OK, status.getState());
            assertEquals("48213", status.getCode());
            assertTrue(status.hasCode());
        }

        @Test
        void parsesWaitingAndCancelledStatus() {
            ActivationStatus waiting = codec.parseStatus("STATUS_WAIT_CODE");
            assertEquals(ActivationStatus.State.WAIT_CODE, waiting.getState());
            assertFalse(waiting.hasCode());

            assertTrue(codec.parseStatus("STATUS_CANCEL").isCancelled());
            assertEquals(ActivationStatus.State.WAIT_RETRY, codec.parseStatus("STATUS_WAIT_RETRY:1111").getState());
            assertEquals(ActivationStatus.State.UNKNOWN, codec.parseStatus("STATUS_SOMETHING").getState());
        }

        @Test
        void parsesBalance() {
            assertEquals(new BigDecimal("154.32"), codec.parseBalance("ACCESS_BALANCE:154.32"));
            assertThrows(ProviderException.class, () -> codec.parseBalance("ACCESS_BALANCE:abc"));
        }

        @Test
        void parsesSetStatusReplies() {
            assertEquals("ACCESS_CANCEL", codec.parseSetStatus("ACCESS_CANCEL"));
            assertThrows(ProviderException.class, () -> codec.parseSetStatus("ACCESS_NOPE"));
        }

        @Test
        void parsesFullSms() {
            assertEquals("Your code is 48213", codec.parseFullSms("FULL_SMS:Your code is 48213"));
        }

        @Test
        @DisplayName("Price lookup reads country/service/cost and returns zero when absent")
        void parsesPrice() {
            String body = "{\"0\":{\"tg\":{\"cost\":0.50,\"count\":120}},\"12\":{\"wa\":{\"cost\":\"1.25\",\"count\":3}}}";
            assertEquals(0, new BigDecimal("0.50").compareTo(codec.parsePrice(body, "0", "tg")));
            assertEquals(0, new BigDecimal("1.25").compareTo(codec.parsePrice(body, "12", "wa")));
            assertEquals(BigDecimal.ZERO, codec.parsePrice(body, "0", "wa"));
            assertEquals(BigDecimal.ZERO, codec.parsePrice(body, "99", "tg"));
        }

        @Test
        void rejectsInvalidPriceDocument() {
            ProviderException e = assertThrows(ProviderException.class,
                    () -> codec.parsePrice("not json", "0", "tg"));
            assertEquals(ProviderErrorCode.UNEXPECTED_RESPONSE, e.getCode());
        }
    }
}
