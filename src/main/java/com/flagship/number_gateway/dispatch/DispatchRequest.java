package com.flagship.number_gateway.dispatch;

import com.flagship.number_gateway.provider.ProviderException;
import com.flagship.number_gateway.provider.ProviderReply;
import com.flagship.number_gateway.provider.ProviderRequest;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A provider request travelling through the dispatcher, with its validated state machine.
 *
 * State changes are synchronized because a worker thread completes a request while the
 * caller may time it out concurrently.
 */
@Getter
public class DispatchRequest {

    private final long id;
    private final ProviderRequest request;
    private final Instant submittedAt;
    private final Instant deadline;
    private final CompletableFuture<ProviderReply> future = new CompletableFuture<>();

    private DispatchState state = DispatchState.QUEUED;
    private int throttleCount;
    private Instant eligibleAt;
    private boolean abandoned;

    public DispatchRequest(long id, ProviderRequest request, Instant submittedAt, Instant deadline) {
        this.id = id;
        this.request = request;
        this.submittedAt = submittedAt;
        this.deadline = deadline;
        this.eligibleAt = submittedAt;
    }

    public synchronized DispatchState getState() {
        return state;
    }

    public synchronized int getThrottleCount() {
        return throttleCount;
    }

    public synchronized Instant getEligibleAt() {
        return eligibleAt;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized boolean isEligible(Instant now) {
        return !now.isBefore(eligibleAt);
    }

    public synchronized boolean isPastDeadline(Instant now) {
        return now.isAfter(deadline);
    }

    public synchronized boolean isAbandoned() {
        return abandoned;
    }

    /**
     * Moves a queued or retry-scheduled request to DISPATCHING.
     *
     * @return false when the request already finished and must not be sent
     */
    public synchronized boolean tryDispatch() {
        if (state.isTerminal()) {
            return false;
        }
        if (state == DispatchState.RETRY_SCHEDULED) {
            transitionTo(DispatchState.QUEUED);
        }
        transitionTo(DispatchState.DISPATCHING);
        return true;
    }

    public synchronized void markDispatching() {
        transitionTo(DispatchState.DISPATCHING);
    }

    public synchronized void markRequeued() {
        transitionTo(DispatchState.QUEUED);
    }

    /**
     * Records a throttle and schedules the request to become eligible again at {@code eligibleAt}.
     */
    public synchronized void scheduleRetry(Instant eligibleAt) {
        transitionTo(DispatchState.RETRY_SCHEDULED);
        this.throttleCount++;
        this.eligibleAt = eligibleAt;
    }

    /**
     * @return true when the caller had already given up, so nobody will see this reply
     */
    public synchronized boolean succeed(ProviderReply reply) {
        transitionTo(DispatchState.SUCCEEDED);
        future.complete(reply);
        return abandoned;
    }

    public synchronized void fail(ProviderException error) {
        transitionTo(DispatchState.FAILED);
        future.completeExceptionally(error);
    }

    /**
     * Fails the request unless it already finished.
     *
     * @return true when this call moved it to FAILED
     */
    public synchronized boolean failIfActive(ProviderException error) {
        if (state.isTerminal() || state == DispatchState.DISPATCHING) {
            return false;
        }
        fail(error);
        return true;
    }

    /**
     * Called when the caller stops waiting. A request not yet in flight is failed with {@code error};
     * an in-flight one is marked abandoned and left to finish.
     *
     * @return false when the request had already finished
     */
    public synchronized boolean giveUp(ProviderException error) {
        if (state.isTerminal()) {
            return false;
        }
        if (state == DispatchState.DISPATCHING) {
            abandoned = true;
            return true;
        }
        fail(error);
        return true;
    }

    private void transitionTo(DispatchState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Request " + id + " cannot move from " + state + " to " + target);
        }
        this.state = target;
    }
}
