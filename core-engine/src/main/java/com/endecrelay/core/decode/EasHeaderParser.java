package com.endecrelay.core.decode;

import com.endecrelay.core.location.LocationDirectory;
import com.endecrelay.core.model.EasHeader;
import com.endecrelay.core.model.Originator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the fixed-width EAS {@code ZCZC} header.
 *
 * <h3>Grammar</h3>
 *
 * <pre>
 *   ZCZC-ORG-EEE-LLLLLL[-LLLLLL...]+TTTT-JJJHHMM-SSSSSSSS-
 * </pre>
 * <ul>
 * <li>{@code ORG} - one of EAS, CIV, WXR, PEP</li>
 * <li>{@code EEE} - three-letter event code</li>
 * <li>{@code LLLLLL} - 1 to 31 six-digit location codes</li>
 * <li>{@code TTTT} - duration, {@code hhmm}</li>
 * <li>{@code JJJHHMM} - issue time, day-of-year plus {@code hhmm}, UTC</li>
 * <li>{@code SSSSSSSS} - sender, 8 characters of letters, digits, '/' or
 * space</li>
 * </ul>
 *
 * <p>
 * Every field is fixed width. Text that looks like a header but breaks a width
 * or charset rule is rejected outright; the parser never returns a partially
 * filled header and never throws for bad input.
 * </p>
 *
 * <h3>Time handling</h3>
 * <p>
 * The issue instant is computed by adding {@code (JJJ - 1)} days, {@code HH}
 * hours and {@code MM} minutes to January 1st of the current UTC year. The
 * components are added, not validated, so out-of-range hours or minutes roll
 * over.
 * </p>
 *
 * @since 1.0.0
 */
public final class EasHeaderParser {

    private static final Logger LOG = LoggerFactory.getLogger(EasHeaderParser.class);

    /** Prefix shared by every header, used to spot malformed candidates. */
    public static final String HEADER_PREFIX = "ZCZC-";

    /** Maximum number of location codes in one header. */
    public static final int MAX_LOCATIONS = 31;

    static final String GRAMMAR = "ZCZC-(EAS|CIV|WXR|PEP)-([A-Z]{3})-"
            + "(\\d{6}(?:-\\d{6}){0," + (MAX_LOCATIONS - 1) + "})"
            + "\\+(\\d{4})-(\\d{7})-([A-Za-z0-9/ ]{8})-";

    private static final Pattern HEADER = Pattern.compile(GRAMMAR);

    private final LocationDirectory locations;
    private final ZoneId localZone;
    private final Clock clock;

    /**
     * @param locations directory used to name location codes
     * @param localZone zone for the local rendering of the issue time
     */
    public EasHeaderParser(LocationDirectory locations, ZoneId localZone) {
        this(locations, localZone, Clock.systemUTC());
    }

    /**
     * @param locations directory used to name location codes
     * @param localZone zone for the local rendering of the issue time
     * @param clock     source of the current year
     */
    public EasHeaderParser(LocationDirectory locations, ZoneId localZone, Clock clock) {
        this.locations = Objects.requireNonNull(locations, "LocationDirectory must not be null");
        this.localZone = Objects.requireNonNull(localZone, "localZone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Parse a candidate that must be a header and nothing else.
     *
     * @param candidate text to parse; leading and trailing whitespace is
     *                  ignored
     * @return the parsed header, or empty if the candidate does not match the
     *         grammar exactly
     */
    public Optional<EasHeader> parse(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String trimmed = candidate.strip();
        Matcher m = HEADER.matcher(trimmed);
        if (!m.matches()) {
            logIfMalformed(trimmed);
            return Optional.empty();
        }
        return Optional.of(toHeader(m));
    }

    /**
     * Search for the first header anywhere inside {@code text}.
     *
     * @param text text to search
     * @return the first match and its span, or empty if none is found
     */
    public Optional<HeaderMatch> find(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = HEADER.matcher(text);
        if (!m.find()) {
            logIfMalformed(text);
            return Optional.empty();
        }
        return Optional.of(new HeaderMatch(toHeader(m), m.start(), m.end()));
    }

    /**
     * Convert a raw {@code hhmm} duration to minutes.
     *
     * @param hhmm four-digit duration
     * @return total minutes, {@code (v / 100) * 60 + (v % 100)}
     */
    public static int durationMinutes(String hhmm) {
        int value = Integer.parseInt(hhmm);
        return (value / 100) * 60 + (value % 100);
    }

    public ZoneId getLocalZone() {
        return localZone;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private EasHeader toHeader(Matcher m) {
        String raw = m.group(0);
        Originator originator = Originator.fromCode(m.group(1))
                .orElseThrow(() -> new IllegalStateException("Grammar admitted unknown originator " + m.group(1)));
        String eventCode = m.group(2);
        List<String> codes = List.of(m.group(3).split("-"));
        List<String> names = new ArrayList<>(codes.size());
        for (String code : codes) {
            names.add(locations.resolve(code));
        }
        String duration = m.group(4);
        String issueTime = m.group(5);
        Instant issuedAt = issueInstant(issueTime);

        if (!EasEventCodes.isKnown(eventCode)) {
            LOG.info("Unrecognized EAS event code '{}' in header {}", eventCode, raw);
        }

        return EasHeader.builder()
                .rawHeader(raw)
                .originator(originator)
                .eventCode(eventCode)
                .eventName(EasEventCodes.nameOf(eventCode))
                .locationCodes(codes)
                .locations(names)
                .durationRaw(duration)
                .durationMinutes(durationMinutes(duration))
                .issueTimeRaw(issueTime)
                .issuedAt(issuedAt)
                .issuedAtLocal(issuedAt.atZone(localZone))
                .senderId(m.group(6).stripTrailing())
                .build();
    }

    private Instant issueInstant(String jjjhhmm) {
        int dayOfYear = Integer.parseInt(jjjhhmm.substring(0, 3));
        int hours = Integer.parseInt(jjjhhmm.substring(3, 5));
        int minutes = Integer.parseInt(jjjhhmm.substring(5, 7));
        int year = LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear();
        return LocalDate.of(year, 1, 1)
                .atStartOfDay(ZoneOffset.UTC)
                .plusDays(dayOfYear - 1L)
                .plusHours(hours)
                .plusMinutes(minutes)
                .toInstant();
    }

    private static void logIfMalformed(String text) {
        if (LOG.isDebugEnabled() && text.contains(HEADER_PREFIX)) {
            LOG.debug("Header-like text failed strict validation, treating as message text: {}", text);
        }
    }
}
