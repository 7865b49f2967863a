package com.endecrelay.relay.sink;

import com.endecrelay.relay.JsonMappers;
import com.endecrelay.relay.support.Alerts;
import com.endecrelay.relay.support.CapturingHttpServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiscordSink} embed building and delivery.
 */
class DiscordSinkTest {

    private final ObjectMapper mapper = JsonMappers.create();

    @Test
    @DisplayName("Should build an embed titled by the event with header fields")
    void shouldBuildHeaderEmbed() {
        ObjectNode payload = DiscordSink.payload(Alerts.tornado("Take shelter now"), mapper);

        JsonNode embed = payload.get("embeds").get(0);
        assertThat(embed.get("title").asText()).isEqualTo("Tornado Warning");
        assertThat(embed.get("description").asText()).isEqualTo("Take shelter now");
        JsonNode fields = embed.get("fields");
        assertThat(fields).hasSize(8);
        assertThat(fields.get(0).get("name").asText()).isEqualTo("Originator");
        assertThat(fields.get(0).get("value").asText()).isEqualTo("National Weather Service (WXR)");
        assertThat(fields.get(2).get("value").asText()).isEqualTo("Dallas County, TX");
        assertThat(fields.get(3).get("value").asText()).isEqualTo("30 minute(s)");
        assertThat(fields.get(7).get("value").asText()).isEqualTo(Alerts.TORNADO_HEADER);
    }

    @Test
    @DisplayName("Should title plain-text alerts and mark the header as not found")
    void shouldBuildPlainTextEmbed() {
        ObjectNode payload = DiscordSink.payload(Alerts.plainText("School closed"), mapper);

        JsonNode embed = payload.get("embeds").get(0);
        assertThat(embed.get("title").asText()).isEqualTo("Plain Text Message");
        assertThat(embed.get("fields")).hasSize(1);
        assertThat(embed.get("fields").get(0).get("value").asText()).isEqualTo("Not found");
    }

    @Test
    @DisplayName("Should truncate the description to the embed limit")
    void shouldTruncateDescription() {
        ObjectNode payload = DiscordSink.payload(Alerts.plainText("y".repeat(5_000)), mapper);

        String description = payload.get("embeds").get(0).get("description").asText();
        assertThat(description).hasSize(DiscordSink.MAX_DESCRIPTION).endsWith("...");
        assertThat(DiscordSink.truncate("z".repeat(2_000), DiscordSink.MAX_FIELD_VALUE))
                .hasSize(DiscordSink.MAX_FIELD_VALUE);
        assertThat(DiscordSink.truncate("short", DiscordSink.MAX_FIELD_VALUE)).isEqualTo("short");
    }

    @Test
    @DisplayName("Should POST the embed to each webhook")
    void shouldPostEmbed() throws Exception {
        try (CapturingHttpServer server = new CapturingHttpServer()) {
            DiscordSink sink = new DiscordSink(List.of(server.uri("/api/webhooks/1/abc")),
                    JsonHttpClient.create(mapper));

            DeliveryResult result = sink.send(Alerts.tornado("Take shelter now"));

            assertThat(result.isSuccess()).isTrue();
            JsonNode json = mapper.readTree(server.requests().get(0).body);
            assertThat(json.get("embeds").get(0).get("title").asText()).isEqualTo("Tornado Warning");
        }
    }
}
