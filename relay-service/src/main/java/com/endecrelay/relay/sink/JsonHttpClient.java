package com.endecrelay.relay.sink;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Small JSON-over-HTTP helper shared by the HTTP sinks.
 *
 * @since 1.0.0
 */
public class JsonHttpClient {

    /** Connect and request timeout used by the HTTP sinks. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public JsonHttpClient(HttpClient httpClient, ObjectMapper mapper, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    /**
     * Client with {@link #DEFAULT_TIMEOUT} for connecting and for each request.
     */
    public static JsonHttpClient create(ObjectMapper mapper) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(DEFAULT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new JsonHttpClient(client, mapper, DEFAULT_TIMEOUT);
    }

    /**
     * POST {@code payload} as JSON.
     *
     * @return the HTTP status code
     * @throws IOException          on serialization, connection or timeout
     *                              failure
     * @throws InterruptedException if interrupted while waiting
     */
    public int post(URI uri, Object payload) throws IOException, InterruptedException {
        byte[] body = mapper.writeValueAsBytes(payload);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        return response.statusCode();
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
