package com.endecrelay.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered lines of raw text collected between an {@code <ENDECSTART>} and an
 * {@code <ENDECEND>} marker.
 *
 * <p>
 * Lines are already stripped and never blank. A block is only ever handed
 * from the frame assembler to the block resolver and then discarded.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertBlock {

    /** Why the assembler closed the block. */
    public enum CloseReason {
        /** The end marker was seen. */
        END_MARKER,
        /** The serial read timed out while the block was open. */
        TIMEOUT,
        /** A new start marker arrived before the end marker. */
        SUPERSEDED
    }

    private final List<String> lines;
    private final CloseReason closeReason;

    public AlertBlock(List<String> lines, CloseReason closeReason) {
        this.lines = List.copyOf(Objects.requireNonNull(lines, "lines must not be null"));
        this.closeReason = Objects.requireNonNull(closeReason, "closeReason must not be null");
    }

    /**
     * @return unmodifiable list of content lines
     */
    public List<String> getLines() {
        return lines;
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }

    /**
     * @return {@code true} when the block ended on its end marker
     */
    public boolean isComplete() {
        return closeReason == CloseReason.END_MARKER;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertBlock that))
            return false;
        return lines.equals(that.lines) && closeReason == that.closeReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lines, closeReason);
    }

    @Override
    public String toString() {
        return "AlertBlock{lines=" + lines.size() + ", closeReason=" + closeReason + '}';
    }
}
