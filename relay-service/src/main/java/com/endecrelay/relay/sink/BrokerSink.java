package com.endecrelay.relay.sink;

import com.endecrelay.core.model.ResolvedAlert;
import com.endecrelay.relay.broker.PublishResult;
import com.endecrelay.relay.broker.ReliablePublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * Publishes alerts to the AMQP exchange through a {@link ReliablePublisher}.
 *
 * @since 1.0.0
 */
public class BrokerSink implements Sink {

    private final ReliablePublisher publisher;
    private final String routingKey;
    private final String source;
    private final Clock clock;

    public BrokerSink(ReliablePublisher publisher, String routingKey, String source, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String name() {
        return "broker";
    }

    @Override
    public DeliveryResult send(ResolvedAlert alert) {
        AlertPayload payload = new AlertPayload(source, clock.instant(), alert.getMessageText(),
                AlertFields.easData(alert));
        PublishResult result = publisher.publish(payload, routingKey);
        String detail = result.getOutcome() + " after " + result.getAttempts() + " attempt(s)";
        return result.isDelivered()
                ? DeliveryResult.success(name(), detail)
                : DeliveryResult.failure(name(), detail + ": " + result.getDetail());
    }
}
