package com.flagship.number_gateway.dispatch;

import com.flagship.number_gateway.provider.RequestKind;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * One lane of the dispatcher. Not thread-safe: every access happens under the dispatcher's lock.
 */
@Getter
class DispatchLane {

    private final RequestKind kind;
    private final int concurrency;
    private final Duration minDelay;
    private final Deque<DispatchRequest> queue = new ArrayDeque<>();

    private int inFlight;
    private double multiplier = 1.0;
    private Instant nextAllowedAt = Instant.EPOCH;

    DispatchLane(RequestKind kind, int concurrency, Duration minDelay) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Lane concurrency must be at least 1");
        }
        this.kind = kind;
        this.concurrency = concurrency;
        this.minDelay = minDelay;
    }

    void enqueue(DispatchRequest request) {
        queue.addLast(request);
    }

    void enqueueAtHead(DispatchRequest request) {
        queue.addFirst(request);
    }

    /**
     * Returns the head request when the lane has capacity, its spacing has elapsed and the head is eligible.
     */
    DispatchRequest pollReady(Instant now) {
        if (inFlight >= concurrency || now.isBefore(nextAllowedAt)) {
            return null;
        }
        DispatchRequest head = queue.peekFirst();
        if (head == null || !head.isEligible(now)) {
            return null;
        }
        return queue.pollFirst();
    }

    /**
     * Removes every queued request matching the predicate, handing each to the consumer.
     */
    void removeIf(Predicate<DispatchRequest> predicate, Consumer<DispatchRequest> onRemoved) {
        Iterator<DispatchRequest> it = queue.iterator();
        while (it.hasNext()) {
            DispatchRequest request = it.next();
            if (predicate.test(request)) {
                it.remove();
                onRemoved.accept(request);
            }
        }
    }

    void started(Instant now, Duration spacing) {
        inFlight++;
        nextAllowedAt = now.plus(spacing);
    }

    void finished() {
        inFlight = Math.max(0, inFlight - 1);
    }

    void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    int depth() {
        return queue.size();
    }
}
