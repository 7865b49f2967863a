package com.endecrelay.relay.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for sinks that POST JSON to one or more HTTP endpoints.
 *
 * <p>
 * A non-2xx status, an I/O error or a timeout counts as a failed POST. Every
 * request is attempted even if an earlier one failed.
 * </p>
 */
public abstract class AbstractHttpSink implements Sink {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractHttpSink.class);

    protected final JsonHttpClient client;

    protected AbstractHttpSink(JsonHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    /**
     * POST every request and summarise the outcome.
     */
    protected DeliveryResult postAll(List<Request> requests) {
        int failed = 0;
        String firstError = null;
        for (Request request : requests) {
            Optional<String> error = post(request.uri, request.payload);
            if (error.isPresent()) {
                failed++;
                if (firstError == null) {
                    firstError = error.get();
                }
            }
        }
        String summary = (requests.size() - failed) + "/" + requests.size() + " request(s) accepted";
        return failed == 0
                ? DeliveryResult.success(name(), summary)
                : DeliveryResult.failure(name(), summary + ", first error: " + firstError);
    }

    /**
     * @return an error description, or empty if the endpoint accepted the POST
     */
    protected Optional<String> post(URI uri, Object payload) {
        String target = redact(uri);
        try {
            int status = client.post(uri, payload);
            if (JsonHttpClient.isSuccess(status)) {
                LOG.debug("[{}] POST {} -> {}", name(), target, status);
                return Optional.empty();
            }
            LOG.warn("[{}] POST {} returned HTTP {}", name(), target, status);
            return Optional.of("HTTP " + status + " from " + target);
        } catch (IOException e) {
            LOG.error("[{}] POST {} failed: {}", name(), target, e.toString());
            return Optional.of(e.getClass().getSimpleName() + " from " + target);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of("interrupted while posting to " + target);
        }
    }

    /**
     * Webhook URLs embed their secret in the path, so only scheme and host
     * are logged.
     */
    static String redact(URI uri) {
        return uri.getScheme() + "://" + uri.getHost() + "/...";
    }

    /**
     * One POST: target and JSON payload.
     */
    protected static final class Request {

        private final URI uri;
        private final Object payload;

        public Request(URI uri, Object payload) {
            this.uri = Objects.requireNonNull(uri, "uri must not be null");
            this.payload = Objects.requireNonNull(payload, "payload must not be null");
        }
    }
}
