package com.endecrelay.relay.sink;

import com.endecrelay.core.model.EasHeader;
import com.endecrelay.core.model.ResolvedAlert;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Posts alerts to Discord webhooks as a single embed.
 *
 * <h3>Embed layout</h3>
 * <ul>
 * <li>title: event name, or {@value AlertFields#PLAIN_TEXT_TITLE}</li>
 * <li>description: message body, at most {@value #MAX_DESCRIPTION} characters</li>
 * <li>fields: originator, event code, locations, duration, start times,
 * sender and raw header, each at most {@value #MAX_FIELD_VALUE} characters</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DiscordSink extends AbstractHttpSink {

    static final int MAX_TITLE = 256;
    static final int MAX_DESCRIPTION = 4096;
    static final int MAX_FIELD_VALUE = 1024;

    private static final int COLOR_EAS = 0xD32F2F;
    private static final int COLOR_PLAIN = 0x607D8B;

    private final List<URI> urls;

    public DiscordSink(List<URI> urls, JsonHttpClient client) {
        super(client);
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one Discord webhook URL is required");
        }
        this.urls = List.copyOf(urls);
    }

    @Override
    public String name() {
        return "discord";
    }

    @Override
    public DeliveryResult send(ResolvedAlert alert) {
        ObjectNode payload = payload(alert, client.getMapper());
        List<Request> requests = new ArrayList<>(urls.size());
        for (URI url : urls) {
            requests.add(new Request(url, payload));
        }
        return postAll(requests);
    }

    static ObjectNode payload(ResolvedAlert alert, ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode embeds = root.putArray("embeds");
        ObjectNode embed = embeds.addObject();

        Optional<EasHeader> header = alert.getHeader();
        embed.put("title", truncate(AlertFields.title(alert), MAX_TITLE));
        embed.put("description", truncate(alert.getMessageText(), MAX_DESCRIPTION));
        embed.put("color", header.isPresent() ? COLOR_EAS : COLOR_PLAIN);

        ArrayNode fields = embed.putArray("fields");
        if (header.isPresent()) {
            EasHeader h = header.get();
            addField(fields, "Originator", h.getOriginatorName() + " (" + h.getOriginatorCode() + ")");
            addField(fields, "Event Code", h.getEventCode());
            addField(fields, "Locations", String.join("; ", h.getLocations()));
            addField(fields, "Duration", h.getDurationMinutes() + " minute(s)");
            addField(fields, "Start (UTC)", h.getStartTimeUtc());
            addField(fields, "Start (Local)", h.getStartTimeLocal());
            addField(fields, "Sender", h.getSenderId());
            addField(fields, "Raw Header", h.getRawHeader());
        } else {
            addField(fields, "Raw Header", AlertFields.NOT_FOUND);
        }
        return root;
    }

    private static void addField(ArrayNode fields, String name, String value) {
        ObjectNode field = fields.addObject();
        field.put("name", name);
        field.put("value", truncate(value == null || value.isEmpty() ? AlertFields.NOT_FOUND : value, MAX_FIELD_VALUE));
        field.put("inline", false);
    }

    static String truncate(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max - 3) + "...";
    }
}
