package com.endecrelay.relay.sink;

import com.endecrelay.core.model.ResolvedAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fans a resolved alert out to every configured {@link Sink}, in order.
 *
 * <p>
 * Each sink is isolated: a failed delivery or an unexpected runtime exception
 * is recorded in the {@link DispatchReport} and dispatch continues with the
 * next sink.
 * </p>
 *
 * @since 1.0.0
 */
public class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final List<Sink> sinks;

    /**
     * @param sinks destinations in dispatch order; must not be {@code null} or
     *              empty
     */
    public Dispatcher(List<Sink> sinks) {
        Objects.requireNonNull(sinks, "sinks must not be null");
        if (sinks.isEmpty()) {
            throw new IllegalArgumentException("At least one sink is required");
        }
        this.sinks = Collections.unmodifiableList(new ArrayList<>(sinks));
    }

    public DispatchReport dispatch(ResolvedAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        List<DeliveryResult> results = new ArrayList<>(sinks.size());
        for (Sink sink : sinks) {
            DeliveryResult result;
            try {
                result = sink.send(alert);
            } catch (RuntimeException e) {
                LOG.error("Sink [{}] threw an exception, continuing with next sink", sink.name(), e);
                result = DeliveryResult.failure(sink.name(), e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result.isSuccess()) {
                LOG.debug("Delivered to {}: {}", sink.name(), result.getDetail());
            } else {
                LOG.warn("Delivery to {} failed: {}", sink.name(), result.getDetail());
            }
            results.add(result);
        }
        return new DispatchReport(results);
    }

    public List<Sink> getSinks() {
        return sinks;
    }
}
