package com.flagship.number_gateway.deposit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpPaymentProcessorClientTest {

    private static final String BASE_URL = "https://processor.test/v3";

    private MockRestServiceServer server;
    private HttpPaymentProcessorClient client;

    @BeforeEach
    void setUp() {
        PaymentsProperties properties = new PaymentsProperties();
        properties.setProcessorBaseUrl(BASE_URL);
        properties.setProcessorSecretKey("sk_test");
        properties.setRedirectUrl("https://app.test/deposit/complete");

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpPaymentProcessorClient(properties, new ObjectMapper(), restTemplate);
    }

    @Test
    @DisplayName("Checkout posts the reference and returns the hosted link")
    void createsCheckout() {
        server.expect(requestTo(BASE_URL + "/payments"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk_test"))
                .andExpect(jsonPath("$.tx_ref").value("DEP_u_1_ABCDEF"))
                .andExpect(jsonPath("$.currency").value("NGN"))
                .andExpect(jsonPath("$.meta.user_id").value("u"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"link\":\"https://checkout.test/x\"}}",
                        MediaType.APPLICATION_JSON));

        String link = client.createCheckout("DEP_u_1_ABCDEF", "u", new BigDecimal("15500"), "NGN");

        assertEquals("https://checkout.test/x", link);
        server.verify();
    }

    @Test
    void checkoutWithoutLinkFails() {
        server.expect(requestTo(BASE_URL + "/payments"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{}}", MediaType.APPLICATION_JSON));

        assertThrows(PaymentProcessorException.class,
                () -> client.createCheckout("DEP_u_1_ABCDEF", "u", BigDecimal.TEN, "USD"));
    }

    @Test
    @DisplayName("Verification returns status, processor id, amount and currency")
    void verifiesReference() {
        server.expect(requestTo(BASE_URL + "/transactions/verify_by_reference?tx_ref=DEP_u_1_ABCDEF"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"id\":4455,\"status\":\"successful\","
                        + "\"amount\":15500,\"currency\":\"NGN\"}}", MediaType.APPLICATION_JSON));

        ProcessorVerification verification = client.verify("DEP_u_1_ABCDEF");

        assertTrue(verification.isSuccessful());
        assertEquals("4455", verification.getProviderTxId());
        assertEquals(0, new BigDecimal("15500").compareTo(verification.getAmount()));
        assertEquals("NGN", verification.getCurrency());
    }

    @Test
    @DisplayName("A reference the processor never saw is reported as not activated")
    void unknownReferenceIsNotActivated() {
        server.expect(requestTo(BASE_URL + "/transactions/verify_by_reference?tx_ref=DEP_u_1_ABCDEF"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"status\":\"error\",\"message\":\"No transaction was found for this id\"}"));

        assertTrue(client.verify("DEP_u_1_ABCDEF").isNotActivated());
    }

    @Test
    void notFoundIsNotActivated() {
        server.expect(requestTo(BASE_URL + "/transactions/verify_by_reference?tx_ref=DEP_u_1_ABCDEF"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(client.verify("DEP_u_1_ABCDEF").isNotActivated());
    }

    @Test
    void processorErrorsPropagate() {
        server.expect(requestTo(BASE_URL + "/transactions/verify_by_reference?tx_ref=DEP_u_1_ABCDEF"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR).body("oops"));

        assertThrows(PaymentProcessorException.class, () -> client.verify("DEP_u_1_ABCDEF"));
    }

    @Test
    void errorEnvelopePropagates() {
        server.expect(requestTo(BASE_URL + "/transactions/verify_by_reference?tx_ref=DEP_u_1_ABCDEF"))
                .andRespond(withSuccess("{\"status\":\"error\",\"message\":\"Invalid authorization key\"}",
                        MediaType.APPLICATION_JSON));

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class,
                () -> client.verify("DEP_u_1_ABCDEF"));
        assertTrue(e.getMessage().contains("Invalid authorization key"));
    }
}
