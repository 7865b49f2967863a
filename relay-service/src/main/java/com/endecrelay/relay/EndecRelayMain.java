package com.endecrelay.relay;

import com.endecrelay.core.config.BrokerSettings;
import com.endecrelay.core.config.HealthCheckSettings;
import com.endecrelay.core.config.RelayConfig;
import com.endecrelay.core.config.RelayConfigLoader;
import com.endecrelay.core.decode.BlockResolver;
import com.endecrelay.core.decode.EasHeaderParser;
import com.endecrelay.core.decode.FrameAssembler;
import com.endecrelay.core.location.LocationDirectory;
import com.endecrelay.relay.broker.ReliablePublisher;
import com.endecrelay.relay.health.HealthMonitor;
import com.endecrelay.relay.health.HealthServer;
import com.endecrelay.relay.health.HeartbeatPayload;
import com.endecrelay.relay.serial.SerialLineSource;
import com.endecrelay.relay.sink.BrokerSink;
import com.endecrelay.relay.sink.DiscordSink;
import com.endecrelay.relay.sink.Dispatcher;
import com.endecrelay.relay.sink.GroupMeSink;
import com.endecrelay.relay.sink.JsonHttpClient;
import com.endecrelay.relay.sink.Sink;
import com.endecrelay.relay.sink.WebhookSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Main entry point for the ENDEC relay.
 *
 * <h3>Startup</h3>
 * <ol>
 * <li>Load and validate configuration ({@link RelayConfigLoader}); the first
 * argument, if present, is the configuration file path</li>
 * <li>Check the serial device is a character device</li>
 * <li>Build sinks, publishers, the health monitor and the health server</li>
 * <li>Run {@link EndecRelay} on the main thread until the JVM is asked to
 * stop</li>
 * </ol>
 *
 * <p>
 * Configuration problems are logged and end the process with status 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class EndecRelayMain {

    private static final Logger LOG = LoggerFactory.getLogger(EndecRelayMain.class);

    /** How long the shutdown hook waits for the relay loop to finish. */
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private static final int S_IFMT = 0170000;
    private static final int S_IFCHR = 0020000;

    private EndecRelayMain() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        RelayConfig config;
        LocationDirectory locations;
        try {
            config = RelayConfigLoader.load(args.length > 0 ? args[0] : null, System.getenv());
            if (config.isDebug()) {
                LoggingConfigurator.enableDebugLogging();
            }
            // 2. Serial device sanity check
            checkSerialDevice(config.getSerialPort());
            locations = config.getLocationFile() != null
                    ? LocationDirectory.fromFile(config.getLocationFile())
                    : LocationDirectory.loadDefault();
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            System.exit(1);
            return;
        }
        LOG.info("Starting ENDEC relay {} with config: {}", version(), config);

        // 3. Wire components
        ShutdownSignal shutdown = new ShutdownSignal();
        ObjectMapper mapper = JsonMappers.create();
        Clock clock = Clock.systemUTC();
        List<AutoCloseable> closeables = new ArrayList<>();

        Dispatcher dispatcher;
        HealthMonitor healthMonitor;
        try {
            dispatcher = new Dispatcher(buildSinks(config, mapper, shutdown, clock, closeables));
            healthMonitor = buildHealthMonitor(config, mapper, shutdown, clock, closeables);
        } catch (IllegalArgumentException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            closeAll(closeables);
            System.exit(1);
            return;
        }

        HealthServer healthServer = new HealthServer(healthMonitor, mapper);
        if (config.getHealthCheck().getHttpPort() > 0) {
            healthServer.start(config.getHealthCheck().getHttpPort());
        }

        EasHeaderParser parser = new EasHeaderParser(locations, config.zoneId());

        EndecRelay relay = new EndecRelay(
                new SerialLineSource(config.getSerialPort(), config.getBaudRate(), config.getReadTimeout()),
                new FrameAssembler(),
                new BlockResolver(parser),
                dispatcher,
                healthMonitor,
                config.getReconnectDelay(),
                shutdown);

        // 4. Shutdown hook: signal the loop and wait for it to wind down
        Thread relayThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            shutdown.request();
            try {
                relayThread.join(SHUTDOWN_GRACE.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "relay-shutdown"));

        // 5. Run
        try {
            relay.run();
        } finally {
            closeAll(closeables);
            healthServer.stop();
        }
    }

    // ---------------------------------------------------------------
    // Wiring (package-private for tests)
    // ---------------------------------------------------------------

    static List<Sink> buildSinks(RelayConfig config,
            ObjectMapper mapper,
            ShutdownSignal shutdown,
            Clock clock,
            List<AutoCloseable> closeables) {
        List<Sink> sinks = new ArrayList<>();
        JsonHttpClient http = JsonHttpClient.create(mapper);
        if (!config.getWebhookUrls().isEmpty()) {
            sinks.add(new WebhookSink(toUris(config.getWebhookUrls()), http));
        }
        if (!config.getDiscordUrls().isEmpty()) {
            sinks.add(new DiscordSink(toUris(config.getDiscordUrls()), http));
        }
        if (!config.getGroupMeBotIds().isEmpty()) {
            sinks.add(new GroupMeSink(config.getGroupMeBotIds(), http));
        }
        BrokerSettings broker = config.getBroker();
        if (broker.isEnabled()) {
            ReliablePublisher publisher = ReliablePublisher.create(
                    broker, config.getSourceName() + "-alerts", broker.getExchange(), shutdown, mapper);
            closeables.add(publisher);
            sinks.add(new BrokerSink(publisher, broker.getRoutingKey(), config.getSourceName(), clock));
        }
        LOG.info("Configured sink(s): {}", sinks.stream().map(Sink::name).collect(Collectors.joining(", ")));
        return sinks;
    }

    static HealthMonitor buildHealthMonitor(RelayConfig config,
            ObjectMapper mapper,
            ShutdownSignal shutdown,
            Clock clock,
            List<AutoCloseable> closeables) {
        HealthCheckSettings health = config.getHealthCheck();
        if (!health.isEnabled()) {
            LOG.info("Heartbeats disabled");
            return null;
        }
        ReliablePublisher publisher = ReliablePublisher.create(
                config.getBroker(), config.getSourceName() + "-health", health.getExchange(), shutdown, mapper);
        closeables.add(publisher);
        HeartbeatPayload.SystemInfo info = new HeartbeatPayload.SystemInfo(
                health.getHttpPort(), config.getSourceName(), version());
        return new HealthMonitor(publisher, health.getRoutingKey(), health.getInterval(),
                health.getFailureThreshold(), clock, config.getSourceName(), config.getSerialPort(), info);
    }

    /**
     * Fail fast when a device path exists but is not a character device.
     * Names that are not absolute paths (e.g. {@code COM3}) are not checked.
     *
     * @throws IllegalStateException if the device is missing or of the wrong
     *                               type
     */
    static void checkSerialDevice(String serialPort) {
        Path path = Path.of(serialPort);
        if (!path.isAbsolute()) {
            return;
        }
        if (!Files.exists(path)) {
            throw new IllegalStateException("Serial device does not exist: " + serialPort);
        }
        try {
            Object mode = Files.getAttribute(path, "unix:mode");
            if (mode instanceof Integer m && (m & S_IFMT) != S_IFCHR) {
                throw new IllegalStateException("Serial device is not a character device: " + serialPort);
            }
        } catch (UnsupportedOperationException e) {
            LOG.debug("Cannot inspect device type of {} on this platform", serialPort);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot inspect serial device " + serialPort + ": " + e.getMessage(), e);
        }
    }

    static String version() {
        String version = EndecRelayMain.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    private static List<URI> toUris(List<String> urls) {
        return urls.stream().map(String::strip).map(URI::create).collect(Collectors.toList());
    }

    private static void closeAll(List<AutoCloseable> closeables) {
        for (AutoCloseable closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.warn("Error during shutdown: {}", e.getMessage(), e);
            }
        }
    }
}
