package com.endecrelay.relay.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * JSON body of a heartbeat message.
 *
 * <pre>
 * {
 *   "source_application": "endec-relay",
 *   "event_type": "health_check",
 *   "timestamp_utc": "2026-05-04T22:07:00Z",
 *   "status": "alive",
 *   "serial_port": "/dev/ttyUSB0",
 *   "system_info": {"listening_port": 8080, "application_name": "endec-relay", "version": "1.0.0"}
 * }
 * </pre>
 */
@JsonPropertyOrder({ "source_application", "event_type", "timestamp_utc", "status", "serial_port", "system_info" })
public final class HeartbeatPayload {

    public static final String EVENT_TYPE = "health_check";
    public static final String STATUS_ALIVE = "alive";

    private final String sourceApplication;
    private final Instant timestampUtc;
    private final String serialPort;
    private final SystemInfo systemInfo;

    public HeartbeatPayload(String sourceApplication, Instant timestampUtc, String serialPort, SystemInfo systemInfo) {
        this.sourceApplication = sourceApplication;
        this.timestampUtc = timestampUtc;
        this.serialPort = serialPort;
        this.systemInfo = systemInfo;
    }

    @JsonProperty("source_application")
    public String getSourceApplication() {
        return sourceApplication;
    }

    @JsonProperty("event_type")
    public String getEventType() {
        return EVENT_TYPE;
    }

    @JsonProperty("timestamp_utc")
    public Instant getTimestampUtc() {
        return timestampUtc;
    }

    @JsonProperty("status")
    public String getStatus() {
        return STATUS_ALIVE;
    }

    @JsonProperty("serial_port")
    public String getSerialPort() {
        return serialPort;
    }

    @JsonProperty("system_info")
    public SystemInfo getSystemInfo() {
        return systemInfo;
    }

    /**
     * Static description of the running relay.
     */
    @JsonPropertyOrder({ "listening_port", "application_name", "version" })
    public static final class SystemInfo {

        private final int listeningPort;
        private final String applicationName;
        private final String version;

        public SystemInfo(int listeningPort, String applicationName, String version) {
            this.listeningPort = listeningPort;
            this.applicationName = applicationName;
            this.version = version;
        }

        @JsonProperty("listening_port")
        public int getListeningPort() {
            return listeningPort;
        }

        @JsonProperty("application_name")
        public String getApplicationName() {
            return applicationName;
        }

        @JsonProperty("version")
        public String getVersion() {
            return version;
        }
    }
}
