package com.endecrelay.relay.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – Always {@code 200 OK}; the body carries the
 * heartbeat state, e.g.
 * {@code {"status":"UP","consecutive_failures":0,"last_success_utc":"..."}}</li>
 * <li>{@code GET /readiness} – Same body; {@code 503} while heartbeats are
 * degraded</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}. Without a {@link HealthMonitor}
 * (heartbeats disabled) both endpoints report {@code UP}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final Optional<HealthMonitor> monitor;
    private final ObjectMapper mapper;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param monitor heartbeat monitor to report on, or {@code null} when
     *                heartbeats are disabled
     * @param mapper  JSON mapper for response bodies
     */
    public HealthServer(HealthMonitor monitor, ObjectMapper mapper) {
        this.monitor = Optional.ofNullable(monitor);
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> handle(exchange, false));
            server.createContext("/readiness", exchange -> handle(exchange, true));

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not running
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange, boolean readiness) throws IOException {
        Optional<HealthState> state = monitor.map(HealthMonitor::snapshot);
        boolean degraded = state.map(HealthState::isDegraded).orElse(false);

        byte[] body = render(state, degraded);
        int status = readiness && degraded ? 503 : 200;

        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private byte[] render(Optional<HealthState> state, boolean degraded) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", degraded ? "DEGRADED" : "UP");
        node.put("heartbeats_enabled", state.isPresent());
        state.ifPresent(s -> {
            node.put("consecutive_failures", s.getConsecutiveFailures());
            node.put("last_success_utc", s.getLastSuccess().map(Object::toString).orElse(null));
        });
        return mapper.writeValueAsBytes(node);
    }
}
