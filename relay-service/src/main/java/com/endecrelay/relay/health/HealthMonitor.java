package com.endecrelay.relay.health;

import com.endecrelay.relay.broker.PublishResult;
import com.endecrelay.relay.broker.ReliablePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Sends periodic heartbeats through a dedicated {@link ReliablePublisher}.
 *
 * <h3>Scheduling</h3>
 * <ul>
 * <li>Healthy: a heartbeat is due once {@code interval} has passed since the
 * last success, and immediately at startup.</li>
 * <li>Degraded (after {@code failureThreshold} consecutive failures): a
 * heartbeat is due once {@code interval} has passed since the last degraded
 * retry.</li>
 * </ul>
 *
 * <p>
 * The monitor owns no thread; the relay loop calls {@link #tick()} on every
 * read timeout and after every block. The bookkeeping is synchronized so the
 * HTTP health endpoint can take a {@link #snapshot()} from its own thread.
 * The publish itself runs outside the lock.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

    private final ReliablePublisher publisher;
    private final String routingKey;
    private final Duration interval;
    private final int failureThreshold;
    private final Clock clock;
    private final String sourceApplication;
    private final String serialPort;
    private final HeartbeatPayload.SystemInfo systemInfo;

    private Instant lastSuccess;
    private int consecutiveFailures;
    private Instant lastRetry;

    public HealthMonitor(ReliablePublisher publisher,
            String routingKey,
            Duration interval,
            int failureThreshold,
            Clock clock,
            String sourceApplication,
            String serialPort,
            HeartbeatPayload.SystemInfo systemInfo) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.failureThreshold = failureThreshold;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sourceApplication = sourceApplication;
        this.serialPort = serialPort;
        this.systemInfo = systemInfo;
    }

    /**
     * @return {@code true} if a heartbeat should be sent now
     */
    public synchronized boolean isDue() {
        Instant now = clock.instant();
        if (isDegraded()) {
            return lastRetry == null || !now.isBefore(lastRetry.plus(interval));
        }
        return lastSuccess == null || !now.isBefore(lastSuccess.plus(interval));
    }

    /**
     * Send a heartbeat if one is due.
     *
     * @return {@code true} if a heartbeat was attempted
     */
    public boolean tick() {
        if (!isDue()) {
            return false;
        }
        heartbeat();
        return true;
    }

    /**
     * Send a heartbeat now and update the state.
     *
     * @return {@code true} if the broker confirmed it
     */
    public boolean heartbeat() {
        Instant now = clock.instant();
        HeartbeatPayload payload = new HeartbeatPayload(sourceApplication, now, serialPort, systemInfo);
        PublishResult result = publisher.publish(payload, routingKey);
        return record(now, result);
    }

    public synchronized HealthState snapshot() {
        return new HealthState(lastSuccess, consecutiveFailures, lastRetry, isDegraded());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private synchronized boolean record(Instant now, PublishResult result) {
        if (result.isDelivered()) {
            if (consecutiveFailures > 0) {
                LOG.info("Health check recovered after {} consecutive failure(s)", consecutiveFailures);
            } else {
                LOG.debug("Heartbeat delivered");
            }
            consecutiveFailures = 0;
            lastSuccess = now;
            lastRetry = null;
            return true;
        }

        consecutiveFailures = Math.min(consecutiveFailures + 1, failureThreshold);
        if (isDegraded()) {
            lastRetry = now;
            LOG.error("Heartbeat failed ({}); degraded, next attempt in {} min",
                    result.getOutcome(), interval.toMinutes());
        } else {
            LOG.warn("Heartbeat failed ({}), {}/{} consecutive failure(s)",
                    result.getOutcome(), consecutiveFailures, failureThreshold);
        }
        return false;
    }

    private boolean isDegraded() {
        return consecutiveFailures >= failureThreshold;
    }
}
