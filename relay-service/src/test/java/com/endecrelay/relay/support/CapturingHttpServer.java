package com.endecrelay.relay.support;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local HTTP endpoint that records every request body and answers with a
 * configurable status per path.
 */
public class CapturingHttpServer implements AutoCloseable {

    private final HttpServer server;
    private final List<Captured> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> statusByPath = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public CapturingHttpServer() {
        try {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        server.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            try (InputStream in = exchange.getRequestBody()) {
                requests.add(new Captured(path, exchange.getRequestMethod(),
                        exchange.getRequestHeaders().getFirst("Content-Type"),
                        new String(in.readAllBytes(), StandardCharsets.UTF_8)));
            }
            exchange.sendResponseHeaders(statusByPath.getOrDefault(path, 204), -1);
            exchange.close();
        });
        server.start();
    }

    public URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    public void respondWith(String path, int status) {
        statusByPath.put(path, status);
    }

    public List<Captured> requests() {
        return requests;
    }

    @Override
    public void close() {
        if (stopped.compareAndSet(false, true)) {
            server.stop(0);
        }
    }

    /**
     * One recorded request.
     */
    public static final class Captured {
        public final String path;
        public final String method;
        public final String contentType;
        public final String body;

        Captured(String path, String method, String contentType, String body) {
            this.path = path;
            this.method = method;
            this.contentType = contentType;
            this.body = body;
        }
    }
}
