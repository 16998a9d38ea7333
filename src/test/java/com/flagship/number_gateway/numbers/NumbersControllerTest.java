package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.provider.ActivationAction;
import com.flagship.number_gateway.provider.ActivationLease;
import com.flagship.number_gateway.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class NumbersControllerTest extends IntegrationTestSupport {

    private static final String PURCHASE_BODY = "{\"service\":\"tg\",\"country\":\"0\"}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PriceCache priceCache;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = newUserId();
        priceCache.evict("tg", "0");
        when(providerGateway.getPrice("tg", "0")).thenReturn(new BigDecimal("0.50"));
        when(providerGateway.leaseNumber(eq("tg"), eq("0"), any(), any()))
                .thenReturn(new ActivationLease("act-http-1", "79001234567"));
    }

    @Test
    @DisplayName("POST /api/numbers/purchase returns 201 with the leased number")
    void purchaseReturnsCreated() throws Exception {
        printTestHeader("Purchase Over HTTP");
        fund(userId, "5.00");

        MvcResult result = mockMvc.perform(post("/api/numbers/purchase")
                        .header(CorrelationContext.USER_ID_HEADER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PURCHASE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.number.activation_id").value("act-http-1"))
                .andExpect(jsonPath("$.number.phone_number").value("79001234567"))
                .andExpect(jsonPath("$.number.status").value("WAITING"))
                .andReturn();
        printOutput("Response", result.getResponse().getContentAsString());

        assertEquals(0, new BigDecimal("4.00").compareTo(balanceOf(userId)));
        printSuccess("Number leased and charged");
    }

    @Test
    @DisplayName("Insufficient balance maps to 402")
    void insufficientBalanceIsPaymentRequired() throws Exception {
        mockMvc.perform(post("/api/numbers/purchase")
                        .header(CorrelationContext.USER_ID_HEADER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PURCHASE_BODY))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    void missingUserHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/numbers/purchase")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PURCHASE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_HEADER"));
    }

    @Test
    void blankServiceFailsValidation() throws Exception {
        mockMvc.perform(post("/api/numbers/purchase")
                        .header(CorrelationContext.USER_ID_HEADER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service\":\"\",\"country\":\"0\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.service").exists());
    }

    @Test
    @DisplayName("Cancelling after the dwell time refunds the full price")
    void cancelRefunds() throws Exception {
        fund(userId, "5.00");
        mockMvc.perform(post("/api/numbers/purchase")
                        .header(CorrelationContext.USER_ID_HEADER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PURCHASE_BODY))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/numbers/act-http-1/cancel")
                        .header(CorrelationContext.USER_ID_HEADER, userId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CANCEL_TOO_EARLY"));

        clock.advance(Duration.ofMinutes(5));
        when(providerGateway.setStatus("act-http-1", ActivationAction.CANCEL)).thenReturn("ACCESS_CANCEL");

        mockMvc.perform(post("/api/numbers/act-http-1/cancel")
                        .header(CorrelationContext.USER_ID_HEADER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.number.status").value("CANCELLED"))
                .andExpect(jsonPath("$.refunded_amount").exists());

        assertEquals(0, new BigDecimal("5.00").compareTo(balanceOf(userId)));
    }

    @Test
    void activeAndHistoryListTheUsersNumbers() throws Exception {
        fund(userId, "5.00");
        mockMvc.perform(post("/api/numbers/purchase")
                        .header(CorrelationContext.USER_ID_HEADER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PURCHASE_BODY))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/numbers/active").header(CorrelationContext.USER_ID_HEADER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].activation_id").value("act-http-1"));

        mockMvc.perform(get("/api/numbers/active").header(CorrelationContext.USER_ID_HEADER, "someone-else"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/numbers/history")
                        .header(CorrelationContext.USER_ID_HEADER, userId)
                        .param("size", "500"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownNumberIsNotFound() throws Exception {
        mockMvc.perform(get("/api/numbers/nope/status").header(CorrelationContext.USER_ID_HEADER, userId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NUMBER_NOT_FOUND"));
    }
}
