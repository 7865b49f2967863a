package com.endecrelay.core.decode;

import com.endecrelay.core.model.EasHeader;

import java.util.Objects;

/**
 * A header found inside a larger piece of text, with the character span it
 * occupied ({@code start} inclusive, {@code end} exclusive).
 *
 * @since 1.0.0
 */
public final class HeaderMatch {

    private final EasHeader header;
    private final int start;
    private final int end;

    public HeaderMatch(EasHeader header, int start, int end) {
        this.header = Objects.requireNonNull(header, "header must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public EasHeader getHeader() {
        return header;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "HeaderMatch{" + header.getEventCode() + " @ [" + start + ", " + end + ")}";
    }
}
