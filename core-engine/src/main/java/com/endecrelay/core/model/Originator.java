package com.endecrelay.core.model;

import java.util.Optional;

/**
 * The closed set of EAS originator codes that may appear in the
 * {@code ORG} field of a {@code ZCZC} header.
 *
 * @since 1.0.0
 */
public enum Originator {

    EAS("Broadcast station or cable system"),
    CIV("Civil authorities"),
    WXR("National Weather Service"),
    PEP("Primary Entry Point System");

    private final String displayName;

    Originator(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Look up an originator by its three-letter wire code.
     *
     * @param code wire code, case-sensitive
     * @return the originator, or empty if the code is not part of the closed set
     */
    public static Optional<Originator> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (Originator o : values()) {
            if (o.name().equals(code)) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }
}
