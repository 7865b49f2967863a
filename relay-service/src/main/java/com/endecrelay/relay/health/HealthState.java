package com.endecrelay.relay.health;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only copy of the heartbeat bookkeeping.
 *
 * @since 1.0.0
 */
public final class HealthState {

    private final Instant lastSuccess;
    private final int consecutiveFailures;
    private final Instant lastRetry;
    private final boolean degraded;

    HealthState(Instant lastSuccess, int consecutiveFailures, Instant lastRetry, boolean degraded) {
        this.lastSuccess = lastSuccess;
        this.consecutiveFailures = consecutiveFailures;
        this.lastRetry = lastRetry;
        this.degraded = degraded;
    }

    /**
     * @return time of the last confirmed heartbeat, empty if none succeeded yet
     */
    public Optional<Instant> getLastSuccess() {
        return Optional.ofNullable(lastSuccess);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * @return time of the last attempt made in degraded mode
     */
    public Optional<Instant> getLastRetry() {
        return Optional.ofNullable(lastRetry);
    }

    /**
     * @return {@code true} once the failure threshold has been reached
     */
    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public String toString() {
        return "HealthState{" +
                "lastSuccess=" + lastSuccess +
                ", consecutiveFailures=" + consecutiveFailures +
                ", lastRetry=" + lastRetry +
                ", degraded=" + degraded +
                '}';
    }
}
