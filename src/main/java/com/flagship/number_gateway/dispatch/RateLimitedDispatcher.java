package com.flagship.number_gateway.dispatch;

import com.flagship.number_gateway.observability.GatewayMetrics;
import com.flagship.number_gateway.provider.ProviderAction;
import com.flagship.number_gateway.provider.ProviderClient;
import com.flagship.number_gateway.provider.ProviderErrorCode;
import com.flagship.number_gateway.provider.ProviderErrorKind;
import com.flagship.number_gateway.provider.ProviderException;
import com.flagship.number_gateway.provider.ProviderReply;
import com.flagship.number_gateway.provider.ProviderRequest;
import com.flagship.number_gateway.provider.RequestKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Paces, throttles and retries every call to the number provider.
 *
 * Requests are queued on one of two lanes:
 * - READ: up to {@code read-concurrency} calls in flight, spaced by {@code read-min-delay}
 * - WRITE: strictly one call in flight, spaced by {@code write-min-delay}, FIFO
 *
 * Actual spacing is {@code minDelay x multiplier + jitter}. A throttling reply puts the request back at the
 * head of its lane; without a Retry-After the lane multiplier doubles (capped), with one the request waits
 * exactly that long. A Retry-After at or above the severe threshold pauses both lanes. Successful calls decay
 * the multiplier back toward 1. Any other provider error fails the request at once.
 *
 * Each call is given only what is left of its request deadline. A reply that arrives after the caller gave up
 * is counted as reconciliation-required and handed to the {@link AbandonedReplyHandler}, which may ask for a
 * compensating request.
 *
 * All queue state is guarded by a single lock. One scheduler thread pumps the lanes on a fixed tick and
 * blocking HTTP calls run on a separate worker pool.
 */
@Slf4j
@Component
public class RateLimitedDispatcher {

    private final ProviderClient client;
    private final DispatcherProperties properties;
    private final BackoffPolicy backoff;
    private final AbandonedReplyHandler abandonedReplies;
    private final GatewayMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final DispatchLane readLane;
    private final DispatchLane writeLane;
    private final AtomicLong sequence = new AtomicLong();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    private Instant cooldownUntil = Instant.EPOCH;
    private volatile boolean shutdown;

    @Autowired
    public RateLimitedDispatcher(ProviderClient client, DispatcherProperties properties,
                                 AbandonedReplyHandler abandonedReplies, GatewayMetrics metrics, Clock clock) {
        this(client, properties, BackoffPolicy.from(properties), abandonedReplies, metrics, clock);
    }

    public RateLimitedDispatcher(ProviderClient client, DispatcherProperties properties, BackoffPolicy backoff,
                                 GatewayMetrics metrics, Clock clock) {
        this(client, properties, backoff, AbandonedReplyHandler.NONE, metrics, clock);
    }

    public RateLimitedDispatcher(ProviderClient client, DispatcherProperties properties, BackoffPolicy backoff,
                                 AbandonedReplyHandler abandonedReplies, GatewayMetrics metrics, Clock clock) {
        this.client = client;
        this.properties = properties;
        this.backoff = backoff;
        this.abandonedReplies = abandonedReplies;
        this.metrics = metrics;
        this.clock = clock;
        this.readLane = new DispatchLane(RequestKind.READ, properties.getReadConcurrency(), properties.getReadMinDelay());
        this.writeLane = new DispatchLane(RequestKind.WRITE, 1, properties.getWriteMinDelay());

        this.workers = Executors.newFixedThreadPool(properties.getWorkerThreads(),
            new CustomizableThreadFactory("provider-dispatch-"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
            new CustomizableThreadFactory("provider-pacer-"));
        long tick = Math.max(1, properties.getTickInterval().toMillis());
        scheduler.scheduleWithFixedDelay(this::tick, tick, tick, TimeUnit.MILLISECONDS);

        metrics.registerLaneGauges("read",
            () -> snapshot().getRead().getQueueDepth(),
            () -> snapshot().getRead().getInFlight(),
            () -> snapshot().getRead().getBackoffMultiplier());
        metrics.registerLaneGauges("write",
            () -> snapshot().getWrite().getQueueDepth(),
            () -> snapshot().getWrite().getInFlight(),
            () -> snapshot().getWrite().getBackoffMultiplier());

        log.info("Provider dispatcher started: readConcurrency={}, readMinDelay={}, writeMinDelay={}, maxRetries={}",
            properties.getReadConcurrency(), properties.getReadMinDelay(), properties.getWriteMinDelay(),
            properties.getMaxRetries());
    }

    /**
     * Submits a request and blocks until it completes or the request timeout elapses.
     *
     * @throws ProviderException with kind RATE_LIMITED once retries or the deadline are exhausted while
     *                           throttled, TIMEOUT when the deadline passes otherwise, or the provider's own kind
     */
    public ProviderReply submit(ProviderRequest request) {
        DispatchRequest dispatch = enqueue(request);
        Duration wait = properties.getRequestTimeout().plus(properties.getTickInterval().multipliedBy(4));
        try {
            return dispatch.getFuture().get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ProviderException timeout = new ProviderException(ProviderErrorCode.TRANSPORT_TIMEOUT,
                "Provider request " + request.getAction().getWireName() + " exceeded " + properties.getRequestTimeout());
            if (dispatch.giveUp(timeout)) {
                if (dispatch.isAbandoned()) {
                    log.warn("Caller gave up on in-flight provider request: id={}, action={}",
                        dispatch.getId(), request.getAction().getWireName());
                }
                throw timeout;
            }
            // finished between the wait and the give-up
            try {
                return dispatch.getFuture().get();
            } catch (ExecutionException finished) {
                throw unwrap(finished);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw timeout;
            }
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorCode.TRANSPORT_FAILURE,
                "Interrupted while waiting for provider", null, e);
        }
    }

    private static ProviderException unwrap(ExecutionException e) {
        if (e.getCause() instanceof ProviderException providerException) {
            return providerException;
        }
        return new ProviderException(ProviderErrorCode.TRANSPORT_FAILURE,
            "Provider request failed: " + e.getCause().getMessage(), null, e.getCause());
    }

    public ProviderReply submit(ProviderAction action, Map<String, String> params, RequestKind kind) {
        return submit(new ProviderRequest(action, params, kind));
    }

    public CompletableFuture<ProviderReply> submitAsync(ProviderRequest request) {
        return enqueue(request).getFuture();
    }

    public DispatcherSnapshot snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return new DispatcherSnapshot(laneSnapshot(readLane), laneSnapshot(writeLane),
                now.isBefore(cooldownUntil), cooldownUntil);
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        shutdown = true;
        scheduler.shutdownNow();
        lock.lock();
        try {
            ProviderException closed = ProviderException.ofKind(ProviderErrorKind.UPSTREAM, "Dispatcher shut down");
            readLane.removeIf(r -> true, r -> r.failIfActive(closed));
            writeLane.removeIf(r -> true, r -> r.failIfActive(closed));
        } finally {
            lock.unlock();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Provider dispatcher stopped");
    }

    private DispatchRequest enqueue(ProviderRequest request) {
        if (shutdown) {
            throw ProviderException.ofKind(ProviderErrorKind.UPSTREAM, "Dispatcher is shut down");
        }
        Instant now = clock.instant();
        DispatchRequest dispatch = new DispatchRequest(sequence.incrementAndGet(), request, now,
            now.plus(properties.getRequestTimeout()));
        lock.lock();
        try {
            laneFor(request.getKind()).enqueue(dispatch);
        } finally {
            lock.unlock();
        }
        log.debug("Queued provider request: id={}, action={}, kind={}",
            dispatch.getId(), request.getAction().getWireName(), request.getKind());
        pump();
        return dispatch;
    }

    private void tick() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Dispatcher pump failed", e);
        }
    }

    private void pump() {
        if (shutdown) {
            return;
        }
        List<Runnable> ready = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            expireOverdue(readLane, now);
            expireOverdue(writeLane, now);
            if (now.isBefore(cooldownUntil)) {
                return;
            }
            drain(readLane, now, ready);
            drain(writeLane, now, ready);
        } finally {
            lock.unlock();
        }
        for (Runnable task : ready) {
            try {
                workers.execute(task);
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected provider request during shutdown");
            }
        }
    }

    private void drain(DispatchLane lane, Instant now, List<Runnable> ready) {
        DispatchRequest next;
        while ((next = lane.pollReady(now)) != null) {
            if (!next.tryDispatch()) {
                log.debug("Skipping finished provider request: id={}, state={}", next.getId(), next.getState());
                continue;
            }
            lane.started(now, backoff.spacing(lane.getMinDelay(), lane.getMultiplier()));
            DispatchRequest request = next;
            ready.add(() -> execute(lane, request));
        }
    }

    private void expireOverdue(DispatchLane lane, Instant now) {
        lane.removeIf(r -> r.isTerminal() || r.isPastDeadline(now), r -> {
            if (r.isTerminal()) {
                return;
            }
            ProviderException error = r.getState() == DispatchState.RETRY_SCHEDULED
                ? ProviderException.ofKind(ProviderErrorKind.RATE_LIMITED,
                    "Provider still throttling " + r.getRequest().getAction().getWireName() + " at deadline")
                : ProviderException.ofKind(ProviderErrorKind.TIMEOUT,
                    "Provider request " + r.getRequest().getAction().getWireName() + " was not dispatched before deadline");
            if (r.failIfActive(error)) {
                record(r, "expired_" + error.getKind().name().toLowerCase());
            }
        });
    }

    private void execute(DispatchLane lane, DispatchRequest request) {
        try {
            Duration budget = Duration.between(clock.instant(), request.getDeadline());
            ProviderReply reply = client.execute(request.getRequest(),
                budget.isNegative() || budget.isZero() ? Duration.ofMillis(1) : budget);
            onSuccess(lane, request, reply);
        } catch (ProviderException e) {
            if (e.isRateLimited()) {
                onThrottle(lane, request, e);
            } else {
                onFailure(request, e);
            }
        } catch (RuntimeException e) {
            onFailure(request, new ProviderException(ProviderErrorCode.TRANSPORT_FAILURE,
                "Provider client failed: " + e.getMessage(), null, e));
        } finally {
            lock.lock();
            try {
                lane.finished();
            } finally {
                lock.unlock();
            }
            pump();
        }
    }

    private void onSuccess(DispatchLane lane, DispatchRequest request, ProviderReply reply) {
        lock.lock();
        try {
            lane.setMultiplier(backoff.decay(lane.getMultiplier()));
        } finally {
            lock.unlock();
        }
        boolean abandoned = request.succeed(reply);
        record(request, "success");
        if (abandoned) {
            onAbandonedSuccess(request, reply);
        }
    }

    private void onAbandonedSuccess(DispatchRequest request, ProviderReply reply) {
        ProviderRequest original = request.getRequest();
        metrics.recordReconciliationRequired();
        log.error("RECONCILIATION_REQUIRED: provider completed request after its caller timed out: id={}, action={}, reply={}",
            request.getId(), original.getAction().getWireName(), reply.getBody());
        Optional<ProviderRequest> compensation;
        try {
            compensation = abandonedReplies.compensationFor(original, reply);
        } catch (RuntimeException e) {
            log.error("Could not derive compensation for abandoned request: id={}", request.getId(), e);
            return;
        }
        compensation.ifPresent(undo -> {
            log.warn("Dispatching compensation for abandoned request: id={}, action={}, params={}",
                request.getId(), undo.getAction().getWireName(), undo.getParams());
            try {
                submitAsync(undo).whenComplete((undone, error) -> {
                    if (error != null) {
                        log.error("RECONCILIATION_REQUIRED: compensation failed for abandoned request: id={}, params={}",
                            request.getId(), undo.getParams(), error);
                    } else {
                        log.info("Compensated abandoned request: id={}, reply={}", request.getId(), undone.getBody());
                    }
                });
            } catch (ProviderException e) {
                log.error("RECONCILIATION_REQUIRED: compensation not queued for abandoned request: id={}, params={}",
                    request.getId(), undo.getParams(), e);
            }
        });
    }

    private void onFailure(DispatchRequest request, ProviderException error) {
        log.warn("Provider request failed: id={}, action={}, code={}, message={}",
            request.getId(), request.getRequest().getAction().getWireName(), error.getCode(), error.getMessage());
        request.fail(error);
        record(request, error.getKind().name().toLowerCase());
    }

    private void onThrottle(DispatchLane lane, DispatchRequest request, ProviderException error) {
        metrics.recordThrottle(lane.getKind().name().toLowerCase());
        Instant now = clock.instant();
        Duration retryAfter = error.getRetryAfter();
        boolean failed = false;
        lock.lock();
        try {
            if (backoff.isSevere(retryAfter)) {
                Instant until = now.plus(retryAfter);
                if (until.isAfter(cooldownUntil)) {
                    cooldownUntil = until;
                    metrics.recordGlobalCooldown();
                    log.warn("Severe provider throttling: pausing all lanes until {}", until);
                }
            }

            if (request.getThrottleCount() >= properties.getMaxRetries()) {
                failed = true;
            } else {
                Instant eligibleAt;
                if (retryAfter != null) {
                    eligibleAt = now.plus(retryAfter);
                } else {
                    lane.setMultiplier(backoff.increase(lane.getMultiplier()));
                    eligibleAt = now.plus(backoff.spacing(lane.getMinDelay(), lane.getMultiplier()));
                }
                if (eligibleAt.isAfter(request.getDeadline())) {
                    failed = true;
                } else {
                    request.scheduleRetry(eligibleAt);
                    lane.enqueueAtHead(request);
                    log.info("Provider throttled request: id={}, action={}, attempt={}, eligibleAt={}, multiplier={}",
                        request.getId(), request.getRequest().getAction().getWireName(),
                        request.getThrottleCount(), eligibleAt, lane.getMultiplier());
                }
            }
        } finally {
            lock.unlock();
        }

        if (failed) {
            log.warn("Provider request gave up after throttling: id={}, action={}, throttles={}",
                request.getId(), request.getRequest().getAction().getWireName(), request.getThrottleCount() + 1);
            request.fail(error);
            record(request, "rate_limited");
        }
    }

    private void record(DispatchRequest request, String outcome) {
        metrics.recordDispatch(request.getRequest().getAction().getWireName(), outcome,
            Duration.between(request.getSubmittedAt(), clock.instant()));
    }

    private DispatchLane laneFor(RequestKind kind) {
        return kind == RequestKind.WRITE ? writeLane : readLane;
    }

    private static DispatcherSnapshot.LaneSnapshot laneSnapshot(DispatchLane lane) {
        return new DispatcherSnapshot.LaneSnapshot(lane.depth(), lane.getInFlight(), lane.getConcurrency(),
            lane.getMultiplier());
    }
}
