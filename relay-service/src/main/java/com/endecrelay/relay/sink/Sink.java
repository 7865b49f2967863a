package com.endecrelay.relay.sink;

import com.endecrelay.core.model.ResolvedAlert;

/**
 * A destination for resolved alerts.
 *
 * <p>
 * Implementations report failures through the returned
 * {@link DeliveryResult}; the {@link Dispatcher} also guards against runtime
 * exceptions so one broken sink never blocks the others.
 * </p>
 *
 * @since 1.0.0
 */
public interface Sink {

    /**
     * @return short name used in logs and delivery results
     */
    String name();

    /**
     * Deliver one alert.
     *
     * @param alert the alert; never {@code null}
     * @return the delivery outcome
     */
    DeliveryResult send(ResolvedAlert alert);
}
