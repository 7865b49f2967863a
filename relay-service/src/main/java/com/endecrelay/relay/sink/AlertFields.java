package com.endecrelay.relay.sink;

import com.endecrelay.core.model.EasHeader;
import com.endecrelay.core.model.ResolvedAlert;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared field values for alerts that carry no EAS header.
 */
public final class AlertFields {

    /** Title and event name used for alerts without a header. */
    public static final String PLAIN_TEXT_TITLE = "Plain Text Message";

    /** Placeholder for header fields that are not available. */
    public static final String NOT_FOUND = "Not found";

    private AlertFields() {
        // utility class, not instantiable
    }

    /**
     * @return the {@link EasHeader} itself, or the plain-text placeholder record
     */
    public static Object easData(ResolvedAlert alert) {
        return alert.getHeader().<Object>map(h -> h).orElseGet(AlertFields::plainTextRecord);
    }

    public static String title(ResolvedAlert alert) {
        return alert.getHeader().map(EasHeader::getEventName).orElse(PLAIN_TEXT_TITLE);
    }

    static Map<String, Object> plainTextRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("event_name", PLAIN_TEXT_TITLE);
        record.put("raw_header", NOT_FOUND);
        return record;
    }
}
