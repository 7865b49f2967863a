package com.endecrelay.relay.broker;

import com.endecrelay.core.config.BrokerSettings;
import com.endecrelay.relay.ShutdownSignal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes JSON messages to one AMQP exchange with publisher confirms.
 *
 * <h3>Connection lifecycle</h3>
 * <p>
 * The connection and channel are opened lazily on the first publish and
 * re-opened whenever either is found closed. Every new channel is put in
 * confirm mode, gets a return callback and (re)declares the durable exchange.
 * </p>
 *
 * <h3>Delivery</h3>
 * <ul>
 * <li>Messages are published with {@code mandatory=true}; a returned message
 * is reported as {@link PublishOutcome#UNROUTABLE} without retrying.</li>
 * <li>Connection or channel failures and confirm timeouts are transient: the
 * publisher waits {@code retryDelay * attempt}, drops the connection and
 * tries again.</li>
 * <li>A broker NACK is retried on the same channel.</li>
 * <li>Waits are cut short by the {@link ShutdownSignal}, giving
 * {@link PublishOutcome#CANCELLED}.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe. Each publisher is owned by a single caller.
 * </p>
 *
 * @since 1.0.0
 */
public class ReliablePublisher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ReliablePublisher.class);

    private static final AMQP.BasicProperties PERSISTENT_JSON = new AMQP.BasicProperties.Builder()
            .contentType("application/json")
            .deliveryMode(2)
            .build();

    private final ConnectionFactory factory;
    private final String connectionName;
    private final String exchange;
    private final String exchangeType;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Duration confirmTimeout;
    private final ShutdownSignal shutdown;
    private final ObjectMapper mapper;

    /** Set by the return callback for the message currently in flight. */
    private final AtomicBoolean returned = new AtomicBoolean(false);

    private Connection connection;
    private Channel channel;

    /**
     * @param factory        connection factory, already pointed at the broker
     * @param connectionName client-provided connection name shown by the broker
     * @param exchange       exchange to declare and publish to
     * @param exchangeType   exchange type, e.g. {@code topic}
     * @param maxAttempts    attempt budget per message; must be &gt;= 1
     * @param retryDelay     base back-off, multiplied by the attempt number
     * @param confirmTimeout how long to wait for a publisher confirm
     * @param shutdown       signal that cancels back-off waits
     * @param mapper         JSON mapper for payloads
     */
    public ReliablePublisher(ConnectionFactory factory,
            String connectionName,
            String exchange,
            String exchangeType,
            int maxAttempts,
            Duration retryDelay,
            Duration confirmTimeout,
            ShutdownSignal shutdown,
            ObjectMapper mapper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.connectionName = Objects.requireNonNull(connectionName, "connectionName must not be null");
        this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
        this.exchangeType = Objects.requireNonNull(exchangeType, "exchangeType must not be null");
        this.maxAttempts = maxAttempts;
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout must not be null");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Build a publisher for the broker in {@code settings}, publishing to
     * {@code exchange}.
     *
     * @throws IllegalArgumentException if the broker URL cannot be used
     */
    public static ReliablePublisher create(BrokerSettings settings,
            String connectionName,
            String exchange,
            ShutdownSignal shutdown,
            ObjectMapper mapper) {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(settings.getUrl().strip());
        } catch (URISyntaxException | GeneralSecurityException e) {
            throw new IllegalArgumentException(
                    "Invalid broker URL " + BrokerSettings.redact(settings.getUrl()) + ": " + e.getMessage(), e);
        }
        factory.setAutomaticRecoveryEnabled(false);
        return new ReliablePublisher(factory, connectionName, exchange, settings.getExchangeType(),
                settings.getMaxAttempts(), settings.getRetryDelay(), settings.getConfirmTimeout(),
                shutdown, mapper);
    }

    // ---------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------

    /**
     * Serialize {@code payload} to JSON and publish it with {@code routingKey}.
     *
     * @return the outcome; never throws for broker or serialization problems
     */
    public PublishResult publish(Object payload, String routingKey) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize payload for {}: {}", routingKey, e.getMessage(), e);
            return new PublishResult(PublishOutcome.FAILED, routingKey, 0, "serialization failed: " + e.getMessage());
        }

        String lastError = "no attempt made";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            boolean reconnect = false;
            try {
                Channel ch = ensureChannel();
                returned.set(false);
                ch.basicPublish(exchange, routingKey, true, PERSISTENT_JSON, body);
                boolean acked = ch.waitForConfirms(confirmTimeout.toMillis());
                if (returned.get()) {
                    LOG.error("Message to {}/{} was returned as unroutable", exchange, routingKey);
                    return new PublishResult(PublishOutcome.UNROUTABLE, routingKey, attempt, "no route");
                }
                if (acked) {
                    LOG.debug("Published to {}/{} on attempt {}", exchange, routingKey, attempt);
                    return new PublishResult(PublishOutcome.DELIVERED, routingKey, attempt, "confirmed");
                }
                lastError = "broker NACK";
                LOG.warn("Broker NACKed message to {}/{} (attempt {}/{})", exchange, routingKey, attempt, maxAttempts);
            } catch (IOException | ShutdownSignalException | TimeoutException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                reconnect = true;
                LOG.warn("Publish to {}/{} failed (attempt {}/{}): {}",
                        exchange, routingKey, attempt, maxAttempts, lastError);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new PublishResult(PublishOutcome.CANCELLED, routingKey, attempt, "interrupted");
            }

            if (reconnect) {
                resetConnection();
            }
            if (attempt < maxAttempts && !shutdown.pause(retryDelay.multipliedBy(attempt))) {
                LOG.info("Shutdown requested, abandoning publish to {}/{}", exchange, routingKey);
                return new PublishResult(PublishOutcome.CANCELLED, routingKey, attempt, "shutdown requested");
            }
        }

        LOG.error("Giving up on {}/{} after {} attempt(s): {}", exchange, routingKey, maxAttempts, lastError);
        return new PublishResult(PublishOutcome.FAILED, routingKey, maxAttempts, lastError);
    }

    public String getExchange() {
        return exchange;
    }

    /**
     * Close the channel, then the connection. Teardown errors are logged.
     */
    @Override
    public void close() {
        resetConnection();
    }

    // ---------------------------------------------------------------
    // Connection management
    // ---------------------------------------------------------------

    private Channel ensureChannel() throws IOException, TimeoutException {
        if (connection == null || !connection.isOpen()) {
            resetConnection();
            connection = factory.newConnection(connectionName);
            LOG.info("Connected to broker for exchange {}", exchange);
        }
        if (channel == null || !channel.isOpen()) {
            Channel ch = connection.createChannel();
            if (ch == null) {
                throw new IOException("Broker refused to open a channel");
            }
            ch.confirmSelect();
            ch.addReturnListener(ret -> {
                returned.set(true);
                LOG.warn("Broker returned message: code={} text={} exchange={} key={}",
                        ret.getReplyCode(), ret.getReplyText(), ret.getExchange(), ret.getRoutingKey());
            });
            ch.exchangeDeclare(exchange, exchangeType, true);
            channel = ch;
        }
        return channel;
    }

    private void resetConnection() {
        if (channel != null) {
            try {
                if (channel.isOpen()) {
                    channel.close();
                }
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                LOG.warn("Error closing channel for {}: {}", exchange, e.getMessage());
            }
            channel = null;
        }
        if (connection != null) {
            try {
                if (connection.isOpen()) {
                    connection.close();
                }
            } catch (IOException | ShutdownSignalException e) {
                LOG.warn("Error closing connection for {}: {}", exchange, e.getMessage());
            }
            connection = null;
        }
    }
}
