package com.endecrelay.relay.sink;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * JSON body of an alert published to the broker.
 */
@JsonPropertyOrder({ "source", "timestamp_processed_utc", "message_text", "eas_data" })
public final class AlertPayload {

    private final String source;
    private final Instant processedAt;
    private final String messageText;
    private final Object easData;

    public AlertPayload(String source, Instant processedAt, String messageText, Object easData) {
        this.source = source;
        this.processedAt = processedAt;
        this.messageText = messageText;
        this.easData = easData;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @JsonProperty("timestamp_processed_utc")
    public Instant getProcessedAt() {
        return processedAt;
    }

    @JsonProperty("message_text")
    public String getMessageText() {
        return messageText;
    }

    /**
     * @return the decoded header, or the plain-text placeholder record
     */
    @JsonProperty("eas_data")
    public Object getEasData() {
        return easData;
    }
}
