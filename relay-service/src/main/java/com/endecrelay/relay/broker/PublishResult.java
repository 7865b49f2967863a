package com.endecrelay.relay.broker;

import java.util.Objects;

/**
 * Result of publishing one message: outcome, routing key, number of
 * attempts made and a short human-readable detail.
 *
 * @since 1.0.0
 */
public final class PublishResult {

    private final PublishOutcome outcome;
    private final String routingKey;
    private final int attempts;
    private final String detail;

    public PublishResult(PublishOutcome outcome, String routingKey, int attempts, String detail) {
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.routingKey = routingKey;
        this.attempts = attempts;
        this.detail = detail;
    }

    public PublishOutcome getOutcome() {
        return outcome;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isDelivered() {
        return outcome == PublishOutcome.DELIVERED;
    }

    @Override
    public String toString() {
        return "PublishResult{" +
                "outcome=" + outcome +
                ", routingKey='" + routingKey + '\'' +
                ", attempts=" + attempts +
                ", detail='" + detail + '\'' +
                '}';
    }
}
