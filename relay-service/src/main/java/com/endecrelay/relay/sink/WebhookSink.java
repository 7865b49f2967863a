package com.endecrelay.relay.sink;

import com.endecrelay.core.model.ResolvedAlert;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generic JSON webhook: POSTs {@code {"message": body, "eas": {...}}} to each
 * configured URL.
 *
 * <p>
 * {@code eas} holds every decoded header field, or the plain-text placeholder
 * record when the alert carried no header.
 * </p>
 *
 * @since 1.0.0
 */
public class WebhookSink extends AbstractHttpSink {

    private final List<URI> urls;

    public WebhookSink(List<URI> urls, JsonHttpClient client) {
        super(client);
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one webhook URL is required");
        }
        this.urls = List.copyOf(urls);
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public DeliveryResult send(ResolvedAlert alert) {
        Map<String, Object> payload = payload(alert);
        List<Request> requests = urls.stream()
                .map(url -> new Request(url, payload))
                .collect(Collectors.toCollection(ArrayList::new));
        return postAll(requests);
    }

    static Map<String, Object> payload(ResolvedAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", alert.getMessageText());
        payload.put("eas", AlertFields.easData(alert));
        return payload;
    }
}
