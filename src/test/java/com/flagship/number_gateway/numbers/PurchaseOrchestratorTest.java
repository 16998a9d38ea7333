package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.error.ErrorCode;
import com.flagship.number_gateway.error.GatewayException;
import com.flagship.number_gateway.ledger.TransactionRecord;
import com.flagship.number_gateway.ledger.TransactionType;
import com.flagship.number_gateway.outbox.LedgerEvent;
import com.flagship.number_gateway.outbox.OutboxEventRepository;
import com.flagship.number_gateway.provider.ActivationAction;
import com.flagship.number_gateway.provider.ActivationLease;
import com.flagship.number_gateway.provider.ActivationStatus;
import com.flagship.number_gateway.provider.ProviderErrorCode;
import com.flagship.number_gateway.provider.ProviderException;
import com.flagship.number_gateway.support.IntegrationTestSupport;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end purchase, cancel and sync flows against a real database with the provider mocked.
 */
class PurchaseOrchestratorTest extends IntegrationTestSupport {

    private static final String SERVICE = "tg";
    private static final String COUNTRY = "0";

    @Autowired
    private PurchaseOrchestrator orchestrator;

    @Autowired
    private NumberPurchaseRepository repository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private NumbersProperties numbersProperties;

    @Autowired
    private PriceCache priceCache;

    @Autowired
    private PurchaseLedgerService ledgerService;

    @Autowired
    private MeterRegistry meterRegistry;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = newUserId();
        priceCache.evict(SERVICE, COUNTRY);
        when(providerGateway.getPrice(SERVICE, COUNTRY)).thenReturn(new BigDecimal("0.50"));
    }

    private void leaseReturns(String activationId) {
        when(providerGateway.leaseNumber(eq(SERVICE), eq(COUNTRY), any(), any()))
                .thenReturn(new ActivationLease(activationId, "79001234567"));
    }

    private PurchaseOutcome purchase() {
        return orchestrator.purchase(userId, SERVICE, COUNTRY, null, null);
    }

    @Nested
    @DisplayName("Purchase")
    class Purchase {

        @Test
        @DisplayName("A 0.50 provider cost is charged as 1.00 and recorded once")
        void chargesMarkedUpPrice() {
            printTestHeader("Purchase With Markup");
            fund(userId, "5.00");
            leaseReturns("act-1");

            PurchaseOutcome outcome = purchase();
            printOutput("Outcome", outcome);

            NumberPurchase number = outcome.getPurchase();
            assertEquals(NumberStatus.WAITING, number.getStatus());
            assertEquals(0, new BigDecimal("1.00").compareTo(number.getPrice()));
            assertEquals(0, new BigDecimal("4.00").compareTo(outcome.getBalanceAfter()));
            assertEquals(0, new BigDecimal("4.00").compareTo(balanceOf(userId)));
            assertEquals(clock.instant().plus(numbersProperties.getLeaseDuration()), number.getExpiresAt());

            List<TransactionRecord> records = ledgerStore.findByReference("act-1");
            assertEquals(1, records.size());
            assertEquals(TransactionType.PURCHASE, records.get(0).getType());
            assertEquals(0, new BigDecimal("5.00").compareTo(records.get(0).getBalanceBefore()));

            assertEquals(1, outboxEventRepository.findByEventTypeOrderBySequenceNumberAsc(LedgerEvent.NUMBER_PURCHASED).size());
            assertTrue(repository.findByActivationId("act-1").isPresent());
            printSuccess("Debited 1.00 with ledger record and outbox event");
        }

        @Test
        @DisplayName("Insufficient balance fails before any lease")
        void insufficientBalanceNeverLeases() {
            printTestHeader("Insufficient Balance");
            fund(userId, "0.99");

            GatewayException e = assertThrows(GatewayException.class, this::purchaseOnce);
            printExpectedException(e.getErrorCode().name(), e.getMessage());

            assertEquals(ErrorCode.INSUFFICIENT_BALANCE, e.getErrorCode());
            verify(providerGateway, never()).leaseNumber(anyString(), anyString(), any(), any());
            assertEquals(0, new BigDecimal("0.99").compareTo(balanceOf(userId)));
        }

        @Test
        @DisplayName("No inventory leaves the balance untouched")
        void noNumbersLeavesBalance() {
            printTestHeader("No Numbers Available");
            fund(userId, "5.00");
            when(providerGateway.leaseNumber(eq(SERVICE), eq(COUNTRY), any(), isNull()))
                    .thenThrow(new ProviderException(ProviderErrorCode.NO_NUMBERS, "NO_NUMBERS"));

            GatewayException e = assertThrows(GatewayException.class, this::purchaseOnce);
            printExpectedException(e.getErrorCode().name(), e.getMessage());

            assertEquals(ErrorCode.NO_NUMBERS_AVAILABLE, e.getErrorCode());
            assertEquals(0, new BigDecimal("5.00").compareTo(balanceOf(userId)));
            assertEquals(0, repository.count());
        }

        @Test
        void priceAboveMaximumIsRefused() {
            fund(userId, "5.00");

            GatewayException e = assertThrows(GatewayException.class,
                    () -> orchestrator.purchase(userId, SERVICE, COUNTRY, null, new BigDecimal("0.99")));

            assertEquals(ErrorCode.PRICE_EXCEEDED, e.getErrorCode());
            verify(providerGateway, never()).leaseNumber(anyString(), anyString(), any(), any());
        }

        @Test
        void unpricedServiceIsUnavailable() {
            fund(userId, "5.00");
            when(providerGateway.getPrice("xx", COUNTRY)).thenReturn(BigDecimal.ZERO);

            GatewayException e = assertThrows(GatewayException.class,
                    () -> orchestrator.purchase(userId, "xx", COUNTRY, null, null));

            assertEquals(ErrorCode.SERVICE_UNAVAILABLE, e.getErrorCode());
        }

        @Test
        @DisplayName("A leased number that cannot be recorded is flagged for reconciliation")
        void duplicateActivationRequiresReconciliation() {
            printTestHeader("Reconciliation Required");
            fund(userId, "5.00");
            leaseReturns("act-dup");
            purchase();

            GatewayException e = assertThrows(GatewayException.class, this::purchaseOnce);
            printExpectedException(e.getErrorCode().name(), e.getMessage());

            assertEquals(ErrorCode.RECONCILIATION_REQUIRED, e.getErrorCode());
            assertEquals(0, new BigDecimal("4.00").compareTo(balanceOf(userId)),
                    "Only the first purchase may be charged");
            assertEquals(1, ledgerStore.findByReference("act-dup").size());
        }

        @Test
        @DisplayName("Concurrent purchases never overdraw the balance")
        void concurrentPurchasesNeverOverdraw() throws InterruptedException {
            printTestHeader("Concurrent Purchases");
            fund(userId, "3.00");
            AtomicInteger ids = new AtomicInteger();
            when(providerGateway.leaseNumber(eq(SERVICE), eq(COUNTRY), any(), any()))
                    .thenAnswer(invocation -> new ActivationLease("act-c" + ids.incrementAndGet(), "7900000000"));

            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger insufficient = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        purchaseOnce();
                        succeeded.incrementAndGet();
                    } catch (GatewayException e) {
                        if (e.getErrorCode() == ErrorCode.INSUFFICIENT_BALANCE) {
                            insufficient.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Succeeded", succeeded.get());
            printOutput("Insufficient", insufficient.get());
            assertEquals(3, succeeded.get());
            assertEquals(7, insufficient.get());
            assertEquals(3, ids.get(), "Refused purchases must not lease a number");
            assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(userId)));
        }

        private PurchaseOutcome purchaseOnce() {
            return purchase();
        }
    }

    @Nested
    @DisplayName("Cancel and complete")
    class CancelAndComplete {

        @Test
        @DisplayName("Cancelling before the dwell time is refused, afterwards it refunds")
        void cancelAfterDwellRefunds() {
            printTestHeader("Cancel With Refund");
            fund(userId, "5.00");
            leaseReturns("act-10");
            purchase();
            when(providerGateway.setStatus("act-10", ActivationAction.CANCEL)).thenReturn("ACCESS_CANCEL");

            GatewayException early = assertThrows(GatewayException.class, () -> orchestrator.cancel(userId, "act-10"));
            printExpectedException(early.getErrorCode().name(), early.getMessage());
            assertEquals(ErrorCode.CANCEL_TOO_EARLY, early.getErrorCode());
            verify(providerGateway, never()).setStatus("act-10", ActivationAction.CANCEL);

            clock.advance(Duration.ofMinutes(5));
            PurchaseOutcome outcome = orchestrator.cancel(userId, "act-10");
            printOutput("Outcome", outcome);

            assertEquals(NumberStatus.CANCELLED, outcome.getPurchase().getStatus());
            assertEquals(0, new BigDecimal("1.00").compareTo(outcome.getPurchase().getRefundedAmount()));
            assertEquals(0, new BigDecimal("5.00").compareTo(balanceOf(userId)));
            assertEquals(1, ledgerStore.findByReference("act-10").stream()
                    .filter(r -> r.getType() == TransactionType.REFUND).count());

            GatewayException again = assertThrows(GatewayException.class, () -> orchestrator.cancel(userId, "act-10"));
            assertEquals(ErrorCode.INVALID_STATUS_FOR_CANCEL, again.getErrorCode());
            printSuccess("Refunded once");
        }

        @Test
        @DisplayName("A provider refusal to cancel keeps the number and the money")
        void providerRefusalKeepsState() {
            fund(userId, "5.00");
            leaseReturns("act-11");
            purchase();
            clock.advance(Duration.ofMinutes(5));
            when(providerGateway.setStatus("act-11", ActivationAction.CANCEL))
                    .thenThrow(new ProviderException(ProviderErrorCode.BAD_STATUS, "BAD_STATUS"));

            assertThrows(GatewayException.class, () -> orchestrator.cancel(userId, "act-11"));

            assertEquals(NumberStatus.WAITING, repository.findByActivationId("act-11").orElseThrow().getStatus());
            assertEquals(0, new BigDecimal("4.00").compareTo(balanceOf(userId)));
        }

        @Test
        void otherUsersCannotTouchANumber() {
            fund(userId, "5.00");
            leaseReturns("act-12");
            purchase();

            GatewayException e = assertThrows(GatewayException.class,
                    () -> orchestrator.cancel("someone-else", "act-12"));
            assertEquals(ErrorCode.NUMBER_NOT_FOUND, e.getErrorCode());
        }

        @Test
        @DisplayName("Received numbers complete; waiting numbers cannot")
        void completeRequiresCode() {
            fund(userId, "5.00");
            leaseReturns("act-13");
            purchase();

            GatewayException early = assertThrows(GatewayException.class, () -> orchestrator.complete(userId, "act-13"));
            assertEquals(ErrorCode.INVALID_STATUS_FOR_COMPLETE, early.getErrorCode());

            when(providerGateway.getStatus("act-13")).thenReturn(new ActivationStatus(ActivationStatus.State.OK, "48213"));
            orchestrator.syncStatus(userId, "act-13");
            when(providerGateway.setStatus("act-13", ActivationAction.FINISH)).thenReturn("ACCESS_ACTIVATION");

            PurchaseOutcome outcome = orchestrator.complete(userId, "act-13");

            assertEquals(NumberStatus.USED, outcome.getPurchase().getStatus());
            assertEquals(0, new BigDecimal("4.00").compareTo(balanceOf(userId)));
        }

        @Test
        @DisplayName("A cancel the provider accepted but the ledger refused is flagged for reconciliation")
        void ledgerFailureAfterProviderCancelIsFlagged() {
            printTestHeader("Cancel Needs Reconciliation");
            fund(userId, "5.00");
            leaseReturns("act-15");
            purchase();
            clock.advance(Duration.ofMinutes(5));
            double before = reconciliationCount();
            // the sync job expires the number while the provider call is in flight
            when(providerGateway.setStatus("act-15", ActivationAction.CANCEL)).thenAnswer(invocation -> {
                clock.advance(numbersProperties.getLeaseDuration());
                ledgerService.expire("act-15");
                return "ACCESS_CANCEL";
            });

            GatewayException e = assertThrows(GatewayException.class, () -> orchestrator.cancel(userId, "act-15"));
            printExpectedException(e.getErrorCode().name(), e.getMessage());

            assertEquals(ErrorCode.INVALID_STATUS_FOR_CANCEL, e.getErrorCode());
            assertEquals(NumberStatus.EXPIRED, repository.findByActivationId("act-15").orElseThrow().getStatus());
            assertEquals(before + 1, reconciliationCount(), 1e-9);
            printSuccess("Provider/ledger mismatch counted");
        }

        @Test
        @DisplayName("Retry restarts the lease of a waiting number")
        void retryExtendsLease() {
            fund(userId, "5.00");
            leaseReturns("act-14");
            NumberPurchase purchased = purchase().getPurchase();
            when(providerGateway.setStatus("act-14", ActivationAction.REQUEST_RETRY)).thenReturn("ACCESS_RETRY_GET");

            clock.advance(Duration.ofMinutes(10));
            PurchaseOutcome outcome = orchestrator.retry(userId, "act-14");

            assertTrue(outcome.getPurchase().getExpiresAt().isAfter(purchased.getExpiresAt()));
            assertEquals(clock.instant().plus(numbersProperties.getLeaseDuration()), outcome.getPurchase().getExpiresAt());
        }
    }

    private double reconciliationCount() {
        return meterRegistry.get("ledger.reconciliation_required").counter().count();
    }

    @Nested
    @DisplayName("Status sync")
    class StatusSync {

        @Test
        @DisplayName("A code from the provider moves the number to RECEIVED once")
        void receivesCode() {
            printTestHeader("Sync Receives Code");
            fund(userId, "5.00");
            leaseReturns("act-20");
            purchase();
            when(providerGateway.getStatus("act-20")).thenReturn(new ActivationStatus(ActivationStatus.State.OK, "48213"));

            PurchaseOutcome first = orchestrator.syncActivation("act-20");
            PurchaseOutcome second = orchestrator.syncActivation("act-20");

            assertEquals(NumberStatus.RECEIVED, first.getPurchase().getStatus());
            assertEquals("48213", first.getPurchase().getSmsCode());
            assertNotNull(first.getNotification());
            assertNull(second.getNotification(), "A repeated code is not a change");
            printSuccess("Code stored");
        }

        @Test
        @DisplayName("A provider-side cancel of a waiting number refunds in full")
        void providerCancelRefundsInFull() {
            printTestHeader("Provider Cancel");
            fund(userId, "5.00");
            leaseReturns("act-21");
            purchase();
            when(providerGateway.getStatus("act-21")).thenReturn(new ActivationStatus(ActivationStatus.State.CANCEL, null));

            PurchaseOutcome outcome = orchestrator.syncActivation("act-21");

            assertEquals(NumberStatus.CANCELLED, outcome.getPurchase().getStatus());
            assertEquals(0, new BigDecimal("5.00").compareTo(balanceOf(userId)));
            assertEquals(1, outboxEventRepository.findByEventTypeOrderBySequenceNumberAsc(LedgerEvent.NUMBER_REFUNDED).size());
        }

        @Test
        @DisplayName("An overdue waiting number expires without a refund")
        void overdueNumberExpires() {
            printTestHeader("Expiry");
            fund(userId, "5.00");
            leaseReturns("act-22");
            purchase();
            when(providerGateway.getStatus("act-22")).thenReturn(new ActivationStatus(ActivationStatus.State.WAIT_CODE, null));

            assertNull(orchestrator.syncActivation("act-22").getNotification());

            clock.advance(numbersProperties.getLeaseDuration().plusSeconds(1));
            PurchaseOutcome outcome = orchestrator.syncActivation("act-22");

            assertEquals(NumberStatus.EXPIRED, outcome.getPurchase().getStatus());
            assertEquals(0, new BigDecimal("4.00").compareTo(balanceOf(userId)));
            assertFalse(outcome.movedMoney());
        }

        @Test
        @DisplayName("The sync job expires overdue numbers and keeps going past failures")
        void syncJobBatches() {
            fund(userId, "5.00");
            leaseReturns("act-30");
            purchase();
            leaseReturns("act-31");
            purchase();
            when(providerGateway.getStatus("act-30")).thenReturn(new ActivationStatus(ActivationStatus.State.OK, "1111"));
            when(providerGateway.getStatus("act-31"))
                    .thenThrow(new ProviderException(ProviderErrorCode.TRANSPORT_FAILURE, "down"));
            NumberSyncJob job = new NumberSyncJob(orchestrator, repository, numbersProperties, clock);

            assertEquals(1, job.syncActive());
            assertEquals(NumberStatus.RECEIVED, repository.findByActivationId("act-30").orElseThrow().getStatus());

            clock.advance(numbersProperties.getLeaseDuration().plusMinutes(1));
            assertEquals(1, job.expireOverdue());
            assertEquals(NumberStatus.EXPIRED, repository.findByActivationId("act-31").orElseThrow().getStatus());
        }

        @Test
        void terminalNumbersAreNotPolled() {
            fund(userId, "5.00");
            leaseReturns("act-23");
            purchase();
            clock.advance(numbersProperties.getLeaseDuration().plusSeconds(1));
            orchestrator.expire("act-23");

            NumberPurchase number = orchestrator.syncStatus(userId, "act-23");

            assertEquals(NumberStatus.EXPIRED, number.getStatus());
            verify(providerGateway, never()).getStatus("act-23");
        }

        @Test
        void fullSmsIsFetchedOnceAndStored() {
            fund(userId, "5.00");
            leaseReturns("act-24");
            purchase();
            when(providerGateway.getStatus("act-24")).thenReturn(new ActivationStatus(ActivationStatus.State.OK, "777"));
            orchestrator.syncActivation("act-24");
            when(providerGateway.getFullSms("act-24")).thenReturn("Your code is 777");

            assertEquals("Your code is 777", orchestrator.getFullSms(userId, "act-24"));
            assertEquals("Your code is 777", orchestrator.getFullSms(userId, "act-24"));
            verify(providerGateway, org.mockito.Mockito.times(1)).getFullSms("act-24");
        }
    }
}
