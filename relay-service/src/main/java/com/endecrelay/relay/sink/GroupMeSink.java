package com.endecrelay.relay.sink;

import com.endecrelay.core.model.ResolvedAlert;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts to GroupMe through the bots API.
 *
 * <p>
 * The message body plus {@link #FOOTER} is split into segments of at most
 * {@value #MAX_SEGMENT} characters; every segment is sent, in order, to every
 * configured bot as {@code {"bot_id": ..., "text": ...}}.
 * </p>
 *
 * @since 1.0.0
 */
public class GroupMeSink extends AbstractHttpSink {

    public static final URI BOTS_ENDPOINT = URI.create("https://api.groupme.com/v3/bots/post");

    /** GroupMe rejects longer messages. */
    public static final int MAX_SEGMENT = 500;

    public static final String FOOTER =
            "\n\nThis message was sent using OpenENDEC V2.1 [github/WBOR-91-1-FM/wbor-endec]\n----------";

    private final List<String> botIds;
    private final URI endpoint;

    public GroupMeSink(List<String> botIds, JsonHttpClient client) {
        this(botIds, BOTS_ENDPOINT, client);
    }

    public GroupMeSink(List<String> botIds, URI endpoint, JsonHttpClient client) {
        super(client);
        if (botIds == null || botIds.isEmpty()) {
            throw new IllegalArgumentException("At least one GroupMe bot id is required");
        }
        this.botIds = List.copyOf(botIds);
        this.endpoint = endpoint;
    }

    @Override
    public String name() {
        return "groupme";
    }

    @Override
    public DeliveryResult send(ResolvedAlert alert) {
        List<String> segments = segments(alert.getMessageText() + FOOTER, MAX_SEGMENT);
        List<Request> requests = new ArrayList<>(botIds.size() * segments.size());
        // each segment reaches every bot before the next one goes out
        for (String segment : segments) {
            for (String botId : botIds) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("bot_id", botId);
                payload.put("text", segment);
                requests.add(new Request(endpoint, payload));
            }
        }
        return postAll(requests);
    }

    /**
     * Split {@code text} into consecutive chunks of at most {@code size}
     * characters.
     */
    static List<String> segments(String text, int size) {
        List<String> segments = new ArrayList<>();
        for (int i = 0; i < text.length(); i += size) {
            segments.add(text.substring(i, Math.min(text.length(), i + size)));
        }
        return segments;
    }
}
