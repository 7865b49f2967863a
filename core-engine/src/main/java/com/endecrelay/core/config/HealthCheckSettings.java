package com.endecrelay.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Heartbeat and local health endpoint settings.
 *
 * <p>
 * Heartbeats go to the broker configured under {@code broker.url}, but to
 * their own exchange and routing key. An {@code httpPort} of {@code 0}
 * disables the local HTTP health endpoint.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthCheckSettings {

    private boolean enabled = true;
    private String exchange = "healthcheck";
    private String routingKey = "health.endec";
    private int intervalMinutes = 60;
    private int failureThreshold = 5;
    private int httpPort = 8080;

    void collectErrors(List<String> errors, BrokerSettings broker) {
        if (httpPort < 0 || httpPort > 65_535) {
            errors.add("healthCheck.httpPort must be in [0, 65535], got: " + httpPort);
        }
        if (!enabled) {
            return;
        }
        if (broker == null || !broker.isEnabled()) {
            errors.add("healthCheck requires broker.url (set healthCheck.enabled: false to run without it)");
        }
        if (exchange == null || exchange.isBlank()) {
            errors.add("healthCheck.exchange is required");
        }
        if (routingKey == null || routingKey.isBlank()) {
            errors.add("healthCheck.routingKey is required");
        }
        if (intervalMinutes < 1) {
            errors.add("healthCheck.intervalMinutes must be >= 1, got: " + intervalMinutes);
        }
        if (failureThreshold < 1) {
            errors.add("healthCheck.failureThreshold must be >= 1, got: " + failureThreshold);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public void setRoutingKey(String routingKey) {
        this.routingKey = routingKey;
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    public void setIntervalMinutes(int intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public void setHttpPort(int httpPort) {
        this.httpPort = httpPort;
    }

    public Duration getInterval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    @Override
    public String toString() {
        return "HealthCheckSettings{" +
                "enabled=" + enabled +
                ", exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", intervalMinutes=" + intervalMinutes +
                ", failureThreshold=" + failureThreshold +
                ", httpPort=" + httpPort +
                '}';
    }
}
