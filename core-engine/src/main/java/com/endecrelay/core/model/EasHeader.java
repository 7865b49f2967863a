package com.endecrelay.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Structured view of a {@code ZCZC} EAS header.
 *
 * <p>
 * The raw header text is kept unmodified next to the derived fields so that
 * downstream consumers can audit or re-display exactly what the ENDEC sent.
 * Instances are immutable and serialize to the {@code eas_data} block of the
 * broker payload.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Every field is required: the wire format has no
 * optional fields, so a missing value is a programming error and
 * {@link Builder#build()} throws {@link NullPointerException}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({
        "raw_header", "originator_code", "originator_name", "event_code", "event_name",
        "location_codes", "locations", "duration_raw", "duration_minutes", "issue_time_raw",
        "start_time_utc", "start_time_local", "sender"
})
public final class EasHeader {

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final String rawHeader;
    private final Originator originator;
    private final String eventCode;
    private final String eventName;
    private final List<String> locationCodes;
    private final List<String> locations;
    private final String durationRaw;
    private final int durationMinutes;
    private final String issueTimeRaw;
    private final Instant issuedAt;
    private final ZonedDateTime issuedAtLocal;
    private final String senderId;

    private EasHeader(Builder b) {
        this.rawHeader = Objects.requireNonNull(b.rawHeader, "rawHeader must not be null");
        this.originator = Objects.requireNonNull(b.originator, "originator must not be null");
        this.eventCode = Objects.requireNonNull(b.eventCode, "eventCode must not be null");
        this.eventName = Objects.requireNonNull(b.eventName, "eventName must not be null");
        this.locationCodes = List.copyOf(Objects.requireNonNull(b.locationCodes, "locationCodes must not be null"));
        this.locations = List.copyOf(Objects.requireNonNull(b.locations, "locations must not be null"));
        this.durationRaw = Objects.requireNonNull(b.durationRaw, "durationRaw must not be null");
        this.durationMinutes = b.durationMinutes;
        this.issueTimeRaw = Objects.requireNonNull(b.issueTimeRaw, "issueTimeRaw must not be null");
        this.issuedAt = Objects.requireNonNull(b.issuedAt, "issuedAt must not be null");
        this.issuedAtLocal = Objects.requireNonNull(b.issuedAtLocal, "issuedAtLocal must not be null");
        this.senderId = Objects.requireNonNull(b.senderId, "senderId must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @JsonProperty("raw_header")
    public String getRawHeader() {
        return rawHeader;
    }

    @JsonIgnore
    public Originator getOriginator() {
        return originator;
    }

    @JsonProperty("originator_code")
    public String getOriginatorCode() {
        return originator.name();
    }

    @JsonProperty("originator_name")
    public String getOriginatorName() {
        return originator.getDisplayName();
    }

    @JsonProperty("event_code")
    public String getEventCode() {
        return eventCode;
    }

    @JsonProperty("event_name")
    public String getEventName() {
        return eventName;
    }

    /**
     * @return the six-digit location codes in wire order
     */
    @JsonProperty("location_codes")
    public List<String> getLocationCodes() {
        return locationCodes;
    }

    /**
     * @return resolved names, index-aligned with {@link #getLocationCodes()}
     */
    @JsonProperty("locations")
    public List<String> getLocations() {
        return locations;
    }

    @JsonProperty("duration_raw")
    public String getDurationRaw() {
        return durationRaw;
    }

    @JsonProperty("duration_minutes")
    public int getDurationMinutes() {
        return durationMinutes;
    }

    @JsonProperty("issue_time_raw")
    public String getIssueTimeRaw() {
        return issueTimeRaw;
    }

    @JsonIgnore
    public Instant getIssuedAt() {
        return issuedAt;
    }

    @JsonIgnore
    public ZonedDateTime getIssuedAtLocal() {
        return issuedAtLocal;
    }

    @JsonProperty("start_time_utc")
    public String getStartTimeUtc() {
        return issuedAt.toString();
    }

    @JsonProperty("start_time_local")
    public String getStartTimeLocal() {
        return LOCAL_FORMAT.format(issuedAtLocal);
    }

    @JsonProperty("sender")
    public String getSenderId() {
        return senderId;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EasHeader}.
     */
    public static class Builder {
        private String rawHeader;
        private Originator originator;
        private String eventCode;
        private String eventName;
        private List<String> locationCodes;
        private List<String> locations;
        private String durationRaw;
        private int durationMinutes;
        private String issueTimeRaw;
        private Instant issuedAt;
        private ZonedDateTime issuedAtLocal;
        private String senderId;

        public Builder rawHeader(String rawHeader) {
            this.rawHeader = rawHeader;
            return this;
        }

        public Builder originator(Originator originator) {
            this.originator = originator;
            return this;
        }

        public Builder eventCode(String eventCode) {
            this.eventCode = eventCode;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder locationCodes(List<String> locationCodes) {
            this.locationCodes = locationCodes;
            return this;
        }

        public Builder locations(List<String> locations) {
            this.locations = locations;
            return this;
        }

        public Builder durationRaw(String durationRaw) {
            this.durationRaw = durationRaw;
            return this;
        }

        public Builder durationMinutes(int durationMinutes) {
            this.durationMinutes = durationMinutes;
            return this;
        }

        public Builder issueTimeRaw(String issueTimeRaw) {
            this.issueTimeRaw = issueTimeRaw;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder issuedAtLocal(ZonedDateTime issuedAtLocal) {
            this.issuedAtLocal = issuedAtLocal;
            return this;
        }

        public Builder senderId(String senderId) {
            this.senderId = senderId;
            return this;
        }

        /**
         * @return a new {@link EasHeader}
         * @throws NullPointerException if any field is missing
         */
        public EasHeader build() {
            return new EasHeader(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EasHeader that))
            return false;
        return durationMinutes == that.durationMinutes
                && rawHeader.equals(that.rawHeader)
                && originator == that.originator
                && eventCode.equals(that.eventCode)
                && locationCodes.equals(that.locationCodes)
                && issuedAt.equals(that.issuedAt)
                && senderId.equals(that.senderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawHeader, originator, eventCode, locationCodes, durationMinutes, issuedAt, senderId);
    }

    @Override
    public String toString() {
        return "EasHeader{" +
                "originator=" + originator +
                ", eventCode='" + eventCode + '\'' +
                ", eventName='" + eventName + '\'' +
                ", locationCodes=" + locationCodes +
                ", durationMinutes=" + durationMinutes +
                ", issuedAt=" + issuedAt +
                ", senderId='" + senderId + '\'' +
                '}';
    }
}
