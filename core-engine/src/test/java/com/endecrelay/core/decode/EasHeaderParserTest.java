package com.endecrelay.core.decode;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.endecrelay.core.location.LocationDirectory;
import com.endecrelay.core.model.EasHeader;
import com.endecrelay.core.model.Originator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EasHeaderParser}.
 */
class EasHeaderParserTest {

    private static final String TORNADO = "ZCZC-WXR-TOR-048113+0030-1234567-KXYZ1234-";
    private static final String MONTHLY_TEST = "ZCZC-EAS-RMT-023005-023000+0130-0450310-WBOR/FM -";

    private EasHeaderParser parser;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);
        parser = new EasHeaderParser(LocationDirectory.loadDefault(), ZoneId.of("America/New_York"), clock);
    }

    @Test
    @DisplayName("Should parse every field of a single-location weather header")
    void shouldParseTornadoWarning() {
        EasHeader header = parser.parse(TORNADO).orElseThrow();

        assertThat(header.getRawHeader()).isEqualTo(TORNADO);
        assertThat(header.getOriginator()).isEqualTo(Originator.WXR);
        assertThat(header.getOriginatorName()).isEqualTo("National Weather Service");
        assertThat(header.getEventCode()).isEqualTo("TOR");
        assertThat(header.getEventName()).isEqualTo("Tornado Warning");
        assertThat(header.getLocationCodes()).containsExactly("048113");
        assertThat(header.getLocations()).containsExactly("Dallas County, TX");
        assertThat(header.getDurationMinutes()).isEqualTo(30);
        assertThat(header.getSenderId()).isEqualTo("KXYZ1234");
    }

    @Test
    @DisplayName("Should add out-of-range hours and minutes instead of rejecting them")
    void shouldRollOverIssueTime() {
        // day 123 of 2026 is May 3rd; +45h67m rolls into May 4th
        EasHeader header = parser.parse(TORNADO).orElseThrow();

        assertThat(header.getIssuedAt()).isEqualTo(Instant.parse("2026-05-04T22:07:00Z"));
        assertThat(header.getStartTimeUtc()).isEqualTo("2026-05-04T22:07:00Z");
    }

    @Test
    @DisplayName("Should render the issue time in UTC and in the configured zone")
    void shouldRenderLocalTime() {
        EasHeader header = parser.parse(MONTHLY_TEST).orElseThrow();

        assertThat(header.getIssuedAt()).isEqualTo(Instant.parse("2026-02-14T03:10:00Z"));
        assertThat(header.getStartTimeLocal()).isEqualTo("2026-02-13T22:10:00-05:00");
    }

    @Test
    @DisplayName("Should resolve statewide codes to the state name only and trim the sender")
    void shouldResolveStatewideLocation() {
        EasHeader header = parser.parse(MONTHLY_TEST).orElseThrow();

        assertThat(header.getLocations()).containsExactly("Cumberland County, ME", "Maine");
        assertThat(header.getDurationMinutes()).isEqualTo(90);
        assertThat(header.getSenderId()).isEqualTo("WBOR/FM");
        assertThat(header.getEventName()).isEqualTo("Required Monthly Test");
    }

    @Test
    @DisplayName("Should keep unknown event codes verbatim with an Unknown name")
    void shouldKeepUnknownEventCode() {
        EasHeader header = parser.parse("ZCZC-CIV-QQQ-048999+0015-0010000-CIVILDEF-").orElseThrow();

        assertThat(header.getEventCode()).isEqualTo("QQQ");
        assertThat(header.getEventName()).isEqualTo(EasEventCodes.UNKNOWN);
        assertThat(header.getLocations()).containsExactly(LocationDirectory.UNKNOWN_COUNTY);
    }

    @Test
    @DisplayName("Should accept 31 locations and reject 32")
    void shouldEnforceLocationCount() {
        String thirtyOne = String.join("-", Collections.nCopies(31, "048113"));
        String thirtyTwo = String.join("-", Collections.nCopies(32, "048113"));

        assertThat(parser.parse("ZCZC-WXR-TOR-" + thirtyOne + "+0030-1234567-KXYZ1234-")).isPresent();
        assertThat(parser.parse("ZCZC-WXR-TOR-" + thirtyTwo + "+0030-1234567-KXYZ1234-")).isEmpty();
    }

    @ParameterizedTest(name = "rejects {0}")
    @ValueSource(strings = {
            "ZCZC-ABC-TOR-048113+0030-1234567-KXYZ1234-",  // originator outside the closed set
            "ZCZC-WXR-tor-048113+0030-1234567-KXYZ1234-",  // lower-case event
            "ZCZC-WXR-TOR-48113+0030-1234567-KXYZ1234-",   // five-digit location
            "ZCZC-WXR-TOR-048113+030-1234567-KXYZ1234-",   // three-digit duration
            "ZCZC-WXR-TOR-048113+0030-123456-KXYZ1234-",   // six-digit timestamp
            "ZCZC-WXR-TOR-048113+0030-1234567-KXYZ123-",   // seven-character sender
            "ZCZC-WXR-TOR-048113+0030-1234567-KXYZ_234-",  // bad sender character
            "ZCZC-WXR-TOR-048113+0030-1234567-KXYZ1234",   // missing trailing dash
            "ZCZC-WXR-TOR-048113-0030-1234567-KXYZ1234-",  // dash instead of plus
            "NNNN",
            ""
    })
    void shouldRejectMalformedHeaders(String candidate) {
        assertThat(parser.parse(candidate)).isEmpty();
    }

    @Test
    @DisplayName("Should not anchor when searching free text")
    void shouldFindEmbeddedHeader() {
        String text = "Broadcast follows " + TORNADO + " take cover";

        Optional<HeaderMatch> match = parser.find(text);

        assertThat(match).isPresent();
        assertThat(match.get().getStart()).isEqualTo(18);
        assertThat(match.get().getEnd()).isEqualTo(18 + TORNADO.length());
        assertThat(match.get().getHeader()).isEqualTo(parser.parse(TORNADO).orElseThrow());
    }

    @Test
    @DisplayName("Should reject text that embeds a header in a full-line parse")
    void shouldAnchorParse() {
        assertThat(parser.parse("x" + TORNADO)).isEmpty();
    }

    @ParameterizedTest(name = "{0} -> {1} minutes")
    @CsvSource({"0030,30", "0130,90", "0600,360", "0015,15", "9959,5999"})
    void shouldConvertDurationToMinutes(String raw, int minutes) {
        assertThat(EasHeaderParser.durationMinutes(raw)).isEqualTo(minutes);
    }

    @Test
    @DisplayName("Should log header-like text that fails validation at debug level")
    void shouldLogMalformedCandidateAtDebug() {
        Logger logger = (Logger) LoggerFactory.getLogger(EasHeaderParser.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThat(parser.parse("ZCZC-WXR-TOR-048113+0030-1234567-KXYZ123-")).isEmpty();
            assertThat(parser.parse("Take shelter now")).isEmpty();
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("KXYZ123-");
    }
}
