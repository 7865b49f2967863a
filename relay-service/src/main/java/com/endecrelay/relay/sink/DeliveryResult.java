package com.endecrelay.relay.sink;

import java.util.Objects;

/**
 * Outcome of sending one alert to one {@link Sink}.
 */
public final class DeliveryResult {

    private final String sinkName;
    private final boolean success;
    private final String detail;

    private DeliveryResult(String sinkName, boolean success, String detail) {
        this.sinkName = Objects.requireNonNull(sinkName, "sinkName must not be null");
        this.success = success;
        this.detail = detail;
    }

    public static DeliveryResult success(String sinkName, String detail) {
        return new DeliveryResult(sinkName, true, detail);
    }

    public static DeliveryResult failure(String sinkName, String detail) {
        return new DeliveryResult(sinkName, false, detail);
    }

    public String getSinkName() {
        return sinkName;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return sinkName + (success ? " OK" : " FAILED") + (detail == null ? "" : " (" + detail + ")");
    }
}
