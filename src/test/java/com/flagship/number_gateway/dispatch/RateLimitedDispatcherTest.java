package com.flagship.number_gateway.dispatch;

import com.flagship.number_gateway.observability.GatewayMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.number_gateway.provider.LeaseReleaseHandler;
import com.flagship.number_gateway.provider.ProviderAction;
import com.flagship.number_gateway.provider.ProviderClient;
import com.flagship.number_gateway.provider.ProviderErrorCode;
import com.flagship.number_gateway.provider.ProviderErrorKind;
import com.flagship.number_gateway.provider.ProviderException;
import com.flagship.number_gateway.provider.ProviderReply;
import com.flagship.number_gateway.provider.ProviderRequest;
import com.flagship.number_gateway.provider.ProviderResponseCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pacing, throttling and retry behaviour of the provider dispatcher against a scripted client.
 *
 * Delays are scaled down to milliseconds; assertions on timing keep a generous margin.
 */
class RateLimitedDispatcherTest {

    private RateLimitedDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static DispatcherProperties fastProperties() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setReadConcurrency(2);
        properties.setReadMinDelay(Duration.ofMillis(5));
        properties.setWriteMinDelay(Duration.ofMillis(40));
        properties.setMaxJitter(Duration.ZERO);
        properties.setMaxBackoffMultiplier(6.0);
        properties.setBackoffDecayFactor(0.8);
        properties.setMaxRetries(3);
        properties.setRequestTimeout(Duration.ofSeconds(3));
        properties.setSevereThrottleThreshold(Duration.ofSeconds(10));
        properties.setTickInterval(Duration.ofMillis(5));
        properties.setWorkerThreads(8);
        return properties;
    }

    private RateLimitedDispatcher start(ProviderClient client, DispatcherProperties properties) {
        dispatcher = new RateLimitedDispatcher(client, properties, AbandonedReplyHandler.NONE,
                new GatewayMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
        return dispatcher;
    }

    private RateLimitedDispatcher start(ProviderClient client, DispatcherProperties properties,
                                        AbandonedReplyHandler handler, SimpleMeterRegistry registry) {
        dispatcher = new RateLimitedDispatcher(client, properties, BackoffPolicy.from(properties), handler,
                new GatewayMetrics(registry), Clock.systemUTC());
        return dispatcher;
    }

    private static ProviderException throttled(Duration retryAfter) {
        return new ProviderException(ProviderErrorCode.HTTP_429, "throttled", retryAfter);
    }

    /**
     * Answers calls in order from a script; the last step repeats. Records start times and concurrency.
     */
    static class ScriptedClient implements ProviderClient {

        private final List<Function<ProviderRequest, ProviderReply>> script;
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final List<Long> startNanos = Collections.synchronizedList(new ArrayList<>());
        private final long workMillis;

        @SafeVarargs
        ScriptedClient(long workMillis, Function<ProviderRequest, ProviderReply>... steps) {
            this.workMillis = workMillis;
            this.script = List.of(steps);
        }

        @Override
        public ProviderReply execute(ProviderRequest request) {
            int index = calls.getAndIncrement();
            startNanos.add(System.nanoTime());
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                if (workMillis > 0) {
                    Thread.sleep(workMillis);
                }
                return script.get(Math.min(index, script.size() - 1)).apply(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                inFlight.decrementAndGet();
            }
        }

        int calls() {
            return calls.get();
        }

        int maxInFlight() {
            return maxInFlight.get();
        }

        List<Long> startNanos() {
            synchronized (startNanos) {
                return new ArrayList<>(startNanos);
            }
        }
    }

    private static Function<ProviderRequest, ProviderReply> ok(String body) {
        return request -> new ProviderReply(request.getAction(), body);
    }

    private static Function<ProviderRequest, ProviderReply> fail(ProviderException error) {
        return request -> {
            throw error;
        };
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("A successful reply is returned to the caller unchanged")
        void successIsReturned() {
            printTestHeader("Dispatcher - Success");
            ScriptedClient client = new ScriptedClient(0, ok("ACCESS_BALANCE:12.50"));
            start(client, fastProperties());

            ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_BALANCE));

            printOutput("Reply", reply.getBody());
            assertEquals("ACCESS_BALANCE:12.50", reply.getBody());
            assertEquals(1, client.calls());
            printSuccess("Reply delivered");
        }

        @Test
        @DisplayName("A non-throttle error fails at once without retry")
        void nonThrottleErrorIsNotRetried() {
            printTestHeader("Dispatcher - Business Error");
            ScriptedClient client = new ScriptedClient(0,
                    fail(new ProviderException(ProviderErrorCode.NO_NUMBERS, "Provider returned NO_NUMBERS")));
            start(client, fastProperties());

            ProviderException e = assertThrows(ProviderException.class,
                    () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_NUMBER)));

            printOutput("Kind", e.getKind());
            assertEquals(ProviderErrorKind.NO_INVENTORY, e.getKind());
            assertEquals(ProviderErrorCode.NO_NUMBERS, e.getCode());
            assertEquals(1, client.calls(), "Business errors must never be retried");
            printSuccess("Error surfaced after a single attempt");
        }

        @Test
        @DisplayName("A throttled request is retried transparently and the lane backs off")
        void throttleThenSuccess() {
            printTestHeader("Dispatcher - Throttle Then Success");
            ScriptedClient client = new ScriptedClient(0,
                    fail(throttled(null)),
                    ok("STATUS_WAIT_CODE"));
            start(client, fastProperties());

            ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS));

            DispatcherSnapshot snapshot = dispatcher.snapshot();
            printOutput("Calls", client.calls());
            printOutput("Read multiplier", snapshot.getRead().getBackoffMultiplier());
            assertEquals("STATUS_WAIT_CODE", reply.getBody());
            assertEquals(2, client.calls());
            // doubled to 2.0 on the throttle, decayed by 0.8 on the success
            assertEquals(1.6, snapshot.getRead().getBackoffMultiplier(), 1e-9);
            assertEquals(1.0, snapshot.getWrite().getBackoffMultiplier(), 1e-9);
            printSuccess("Caller never saw the throttle");
        }

        @Test
        @DisplayName("Persistent throttling fails with RATE_LIMITED after max retries")
        void retriesExhausted() {
            printTestHeader("Dispatcher - Retries Exhausted");
            ScriptedClient client = new ScriptedClient(0, fail(throttled(null)));
            start(client, fastProperties());

            ProviderException e = assertThrows(ProviderException.class,
                    () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_PRICES)));

            printOutput("Calls", client.calls());
            assertEquals(ProviderErrorKind.RATE_LIMITED, e.getKind());
            assertEquals(4, client.calls(), "One attempt plus three retries");
            assertEquals(6.0, dispatcher.snapshot().getRead().getBackoffMultiplier(), 1e-9,
                    "Multiplier must stop at the configured cap");
            printSuccess("Gave up after the retry budget");
        }

        @Test
        @DisplayName("A Retry-After beyond the deadline fails immediately instead of waiting")
        void retryAfterPastDeadline() {
            printTestHeader("Dispatcher - Retry-After Past Deadline");
            DispatcherProperties properties = fastProperties();
            properties.setRequestTimeout(Duration.ofMillis(300));
            ScriptedClient client = new ScriptedClient(0, fail(throttled(Duration.ofSeconds(5))));
            start(client, properties);

            long begin = System.nanoTime();
            ProviderException e = assertThrows(ProviderException.class,
                    () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS)));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

            printOutput("Elapsed ms", elapsedMs);
            assertEquals(ProviderErrorKind.RATE_LIMITED, e.getKind());
            assertEquals(1, client.calls());
            assertTrue(elapsedMs < 1000, "Should not wait for a retry that cannot happen in time");
            printSuccess("Failed fast");
        }

        @Test
        @DisplayName("A hung call surfaces as TIMEOUT once the request timeout passes")
        void hungCallTimesOut() {
            printTestHeader("Dispatcher - Timeout");
            DispatcherProperties properties = fastProperties();
            properties.setRequestTimeout(Duration.ofMillis(200));
            ScriptedClient client = new ScriptedClient(1500, ok("STATUS_WAIT_CODE"));
            start(client, properties);

            ProviderException e = assertThrows(ProviderException.class,
                    () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS)));

            printOutput("Kind", e.getKind());
            assertEquals(ProviderErrorKind.TIMEOUT, e.getKind());
            printSuccess("Caller released at the deadline");
        }

        @Test
        @DisplayName("Each call is given no more than what is left of the request deadline")
        void callBudgetFitsDeadline() {
            printTestHeader("Dispatcher - Call Budget");
            DispatcherProperties properties = fastProperties();
            properties.setRequestTimeout(Duration.ofMillis(800));
            AtomicReference<Duration> seen = new AtomicReference<>();
            ProviderClient client = new ProviderClient() {
                @Override
                public ProviderReply execute(ProviderRequest request) {
                    throw new AssertionError("Budgeted overload expected");
                }

                @Override
                public ProviderReply execute(ProviderRequest request, Duration budget) {
                    seen.set(budget);
                    return new ProviderReply(request.getAction(), "STATUS_WAIT_CODE");
                }
            };
            start(client, properties);

            dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS));

            printOutput("Budget", seen.get());
            assertNotNull(seen.get());
            assertTrue(seen.get().compareTo(Duration.ofMillis(800)) <= 0, "Budget exceeded the deadline: " + seen.get());
            assertTrue(seen.get().toMillis() > 0, "Budget must stay positive");
            printSuccess("Call budget bounded by the deadline");
        }

        @Test
        @DisplayName("A number leased after the caller timed out is counted and released with setStatus(8)")
        void lateLeaseIsReleased() throws Exception {
            printTestHeader("Dispatcher - Late Lease Released");
            DispatcherProperties properties = fastProperties();
            properties.setRequestTimeout(Duration.ofMillis(200));
            properties.setWriteMinDelay(Duration.ofMillis(5));
            List<Map<String, String>> cancels = Collections.synchronizedList(new ArrayList<>());
            ProviderClient client = request -> {
                if (request.getAction() == ProviderAction.GET_NUMBER) {
                    try {
                        Thread.sleep(700);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    return new ProviderReply(request.getAction(), "ACCESS_NUMBER:555:79001112233");
                }
                cancels.add(request.getParams());
                return new ProviderReply(request.getAction(), "ACCESS_CANCEL");
            };
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            start(client, properties, new LeaseReleaseHandler(new ProviderResponseCodec(new ObjectMapper())), registry);

            ProviderException e = assertThrows(ProviderException.class,
                    () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_NUMBER)));
            assertEquals(ProviderErrorKind.TIMEOUT, e.getKind());

            long deadline = System.currentTimeMillis() + 3000;
            while (cancels.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            printOutput("Compensations", cancels);
            assertEquals(1, cancels.size(), "Late lease must be cancelled exactly once");
            assertEquals("555", cancels.get(0).get("id"));
            assertEquals("8", cancels.get(0).get("status"));
            assertEquals(1.0, registry.get("ledger.reconciliation_required").counter().count(), 1e-9);
            printSuccess("Late lease flagged and released");
        }

        @Test
        @DisplayName("A late reply to a read is counted but not compensated")
        void lateReadIsOnlyCounted() throws Exception {
            printTestHeader("Dispatcher - Late Read");
            DispatcherProperties properties = fastProperties();
            properties.setRequestTimeout(Duration.ofMillis(150));
            ScriptedClient client = new ScriptedClient(500, ok("STATUS_WAIT_CODE"));
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            start(client, properties, new LeaseReleaseHandler(new ProviderResponseCodec(new ObjectMapper())), registry);

            assertThrows(ProviderException.class,
                    () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS)));
            long deadline = System.currentTimeMillis() + 3000;
            while (registry.get("ledger.reconciliation_required").counter().count() < 1
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            Thread.sleep(100);

            assertEquals(1.0, registry.get("ledger.reconciliation_required").counter().count(), 1e-9);
            assertEquals(1, client.calls(), "No compensation for a read");
            printSuccess("Late read recorded only");
        }
    }

    @Nested
    @DisplayName("Pacing")
    class Pacing {

        @Test
        @DisplayName("Write calls never overlap and are spaced by the write min delay")
        void writesAreSerialised() throws Exception {
            printTestHeader("Dispatcher - Write Lane Serialisation");
            ScriptedClient client = new ScriptedClient(10, ok("ACCESS_READY"));
            start(client, fastProperties());

            List<CompletableFuture<ProviderReply>> futures = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                futures.add(dispatcher.submitAsync(ProviderRequest.of(ProviderAction.SET_STATUS,
                        ProviderRequest.params().put("id", "act-" + i).put("status", 6).build())));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

            List<Long> starts = client.startNanos();
            printOutput("Max in flight", client.maxInFlight());
            assertEquals(1, client.maxInFlight(), "Write lane must keep at most one call in flight");
            for (int i = 1; i < starts.size(); i++) {
                long gapMs = TimeUnit.NANOSECONDS.toMillis(starts.get(i) - starts.get(i - 1));
                printOutput("Gap " + i, gapMs + "ms");
                assertTrue(gapMs >= 30, "Writes must be spaced by the min delay, gap was " + gapMs + "ms");
            }
            printSuccess("Writes serialised and spaced");
        }

        @Test
        @DisplayName("Reads run in parallel up to the lane concurrency")
        void readsAreBounded() throws Exception {
            printTestHeader("Dispatcher - Read Lane Concurrency");
            ScriptedClient client = new ScriptedClient(100, ok("STATUS_WAIT_CODE"));
            start(client, fastProperties());

            List<CompletableFuture<ProviderReply>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(dispatcher.submitAsync(ProviderRequest.of(ProviderAction.GET_STATUS,
                        ProviderRequest.params().put("id", "act-" + i).build())));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

            printOutput("Max in flight", client.maxInFlight());
            assertTrue(client.maxInFlight() <= 2, "Read lane concurrency exceeded: " + client.maxInFlight());
            assertEquals(6, client.calls());
            printSuccess("Read concurrency respected");
        }

        @Test
        @DisplayName("An explicit Retry-After is waited out before the retry")
        void retryAfterIsHonoured() {
            printTestHeader("Dispatcher - Retry-After");
            ScriptedClient client = new ScriptedClient(0,
                    fail(throttled(Duration.ofSeconds(1))),
                    ok("ACCESS_NUMBER:123:79001234567"));
            start(client, fastProperties());

            ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_NUMBER));

            List<Long> starts = client.startNanos();
            long gapMs = TimeUnit.NANOSECONDS.toMillis(starts.get(1) - starts.get(0));
            printOutput("Retry gap", gapMs + "ms");
            assertEquals("ACCESS_NUMBER:123:79001234567", reply.getBody());
            assertTrue(gapMs >= 950, "Retry came too early: " + gapMs + "ms");
            printSuccess("Retry-After honoured");
        }

        @Test
        @DisplayName("More throttles before success never make the caller wait less")
        void waitGrowsWithThrottleCount() {
            printTestHeader("Dispatcher - Monotonic Backoff");
            long previous = -1;
            for (int throttles = 0; throttles <= 3; throttles++) {
                DispatcherProperties properties = fastProperties();
                properties.setReadMinDelay(Duration.ofMillis(50));
                List<Function<ProviderRequest, ProviderReply>> steps = new ArrayList<>();
                for (int i = 0; i < throttles; i++) {
                    steps.add(fail(throttled(null)));
                }
                steps.add(ok("STATUS_WAIT_CODE"));
                @SuppressWarnings("unchecked")
                ScriptedClient client = new ScriptedClient(0, steps.toArray(new Function[0]));
                start(client, properties);

                long begin = System.nanoTime();
                ProviderReply reply = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS));
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);
                dispatcher.shutdown();
                dispatcher = null;

                printOutput("Throttles " + throttles, elapsedMs + "ms");
                assertEquals("STATUS_WAIT_CODE", reply.getBody());
                assertEquals(throttles + 1, client.calls(), "Exactly one successful attempt after the throttles");
                assertTrue(elapsedMs >= previous, "Wait shrank at " + throttles + " throttles: " + elapsedMs + "ms");
                previous = elapsedMs;
            }
            printSuccess("Backoff is monotonic in the throttle count");
        }

        @Test
        @DisplayName("A severe Retry-After pauses the other lane too")
        void severeThrottlePausesAllLanes() throws Exception {
            printTestHeader("Dispatcher - Global Cooldown");
            DispatcherProperties properties = fastProperties();
            properties.setSevereThrottleThreshold(Duration.ofMillis(300));

            AtomicInteger writeCalls = new AtomicInteger();
            List<Long> readStarts = Collections.synchronizedList(new ArrayList<>());
            ProviderClient client = request -> {
                if (request.getAction() == ProviderAction.GET_NUMBER) {
                    if (writeCalls.getAndIncrement() == 0) {
                        throw throttled(Duration.ofMillis(500));
                    }
                    return new ProviderReply(request.getAction(), "ACCESS_NUMBER:1:7900");
                }
                readStarts.add(System.nanoTime());
                return new ProviderReply(request.getAction(), "STATUS_WAIT_CODE");
            };
            start(client, properties);

            CompletableFuture<ProviderReply> write = dispatcher.submitAsync(ProviderRequest.of(ProviderAction.GET_NUMBER));
            long deadline = System.currentTimeMillis() + 2000;
            while (!dispatcher.snapshot().isCoolingDown() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(dispatcher.snapshot().isCoolingDown(), "Severe throttle should start a cooldown");
            long pausedAt = System.nanoTime();

            ProviderReply read = dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS));
            write.get(5, TimeUnit.SECONDS);

            long waitedMs = TimeUnit.NANOSECONDS.toMillis(readStarts.get(0) - pausedAt);
            printOutput("Read waited", waitedMs + "ms");
            assertEquals("STATUS_WAIT_CODE", read.getBody());
            assertTrue(waitedMs >= 200, "Read should have waited for the cooldown, waited " + waitedMs + "ms");
            printSuccess("Cooldown applied to every lane");
        }
    }

    @Test
    @DisplayName("Shutdown fails queued requests and refuses new ones")
    void shutdownFailsQueuedRequests() {
        printTestHeader("Dispatcher - Shutdown");
        DispatcherProperties properties = fastProperties();
        properties.setWriteMinDelay(Duration.ofSeconds(10));
        ScriptedClient client = new ScriptedClient(0, ok("ACCESS_READY"));
        start(client, properties);

        CompletableFuture<ProviderReply> first = dispatcher.submitAsync(ProviderRequest.of(ProviderAction.SET_STATUS));
        CompletableFuture<ProviderReply> queued = dispatcher.submitAsync(ProviderRequest.of(ProviderAction.SET_STATUS));
        assertDoesNotThrow(() -> first.get(2, TimeUnit.SECONDS));

        dispatcher.shutdown();

        ExecutionException e = assertThrows(ExecutionException.class, () -> queued.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ProviderException.class, e.getCause());
        assertThrows(ProviderException.class,
                () -> dispatcher.submit(ProviderRequest.of(ProviderAction.GET_STATUS)));
        dispatcher = null;
        printSuccess("Queued work failed on shutdown");
    }
}
