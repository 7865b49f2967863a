package com.endecrelay.relay.sink;

import com.endecrelay.relay.JsonMappers;
import com.endecrelay.relay.broker.PublishOutcome;
import com.endecrelay.relay.broker.PublishResult;
import com.endecrelay.relay.broker.ReliablePublisher;
import com.endecrelay.relay.support.Alerts;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link BrokerSink}.
 */
@ExtendWith(MockitoExtension.class)
class BrokerSinkTest {

    private static final String KEY = "notification.eas";

    @Mock
    private ReliablePublisher publisher;

    private BrokerSink sink;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-05-04T22:08:15Z"), ZoneOffset.UTC);
        sink = new BrokerSink(publisher, KEY, "wbor-endec", clock);
    }

    @Test
    @DisplayName("Should publish source, processing time, text and header")
    void shouldPublishAlertPayload() {
        when(publisher.publish(any(), eq(KEY)))
                .thenReturn(new PublishResult(PublishOutcome.DELIVERED, KEY, 1, "confirmed"));

        DeliveryResult result = sink.send(Alerts.tornado("Take shelter now"));

        assertThat(result.isSuccess()).isTrue();
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publish(payload.capture(), eq(KEY));
        JsonNode json = JsonMappers.create().valueToTree(payload.getValue());
        assertThat(json.get("source").asText()).isEqualTo("wbor-endec");
        assertThat(json.get("timestamp_processed_utc").asText()).isEqualTo("2026-05-04T22:08:15Z");
        assertThat(json.get("message_text").asText()).isEqualTo("Take shelter now");
        assertThat(json.get("eas_data").get("event_code").asText()).isEqualTo("TOR");
        assertThat(json.get("eas_data").get("start_time_utc").asText()).isEqualTo("2026-05-04T22:07:00Z");
    }

    @Test
    @DisplayName("Should publish the plain-text placeholder when there is no header")
    void shouldPublishPlaceholder() {
        when(publisher.publish(any(), eq(KEY)))
                .thenReturn(new PublishResult(PublishOutcome.DELIVERED, KEY, 1, "confirmed"));

        sink.send(Alerts.plainText("School closed"));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publish(payload.capture(), eq(KEY));
        JsonNode easData = JsonMappers.create().valueToTree(payload.getValue()).get("eas_data");
        assertThat(easData.get("event_name").asText()).isEqualTo("Plain Text Message");
        assertThat(easData.get("raw_header").asText()).isEqualTo("Not found");
    }

    @Test
    @DisplayName("Should report unroutable and failed publishes as failed deliveries")
    void shouldMapFailures() {
        when(publisher.publish(any(), eq(KEY)))
                .thenReturn(new PublishResult(PublishOutcome.UNROUTABLE, KEY, 1, "no route"));

        DeliveryResult result = sink.send(Alerts.plainText("text"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDetail()).contains("UNROUTABLE").contains("no route");
    }
}
