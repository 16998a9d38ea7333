package com.flagship.number_gateway.dispatch;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single dispatched provider request.
 */
public enum DispatchState {
    QUEUED,
    DISPATCHING,
    RETRY_SCHEDULED,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canTransitionTo(DispatchState target) {
        return allowedTargets().contains(target);
    }

    private Set<DispatchState> allowedTargets() {
        return switch (this) {
            case QUEUED -> EnumSet.of(DISPATCHING, FAILED);
            case DISPATCHING -> EnumSet.of(SUCCEEDED, FAILED, RETRY_SCHEDULED);
            case RETRY_SCHEDULED -> EnumSet.of(QUEUED, FAILED);
            case SUCCEEDED, FAILED -> EnumSet.noneOf(DispatchState.class);
        };
    }
}
