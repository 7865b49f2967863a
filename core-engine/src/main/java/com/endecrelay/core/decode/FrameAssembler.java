package com.endecrelay.core.decode;

import com.endecrelay.core.model.AlertBlock;
import com.endecrelay.core.model.AlertBlock.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns newline-delimited serial text into discrete {@link AlertBlock}s.
 *
 * <h3>States</h3>
 * <ul>
 * <li>{@link State#SCANNING} - lines are discarded until one contains
 * {@value #START_MARKER}. Text after the marker is the first content
 * line.</li>
 * <li>{@link State#COLLECTING} - lines are buffered until one contains
 * {@value #END_MARKER}. Text before the marker is the last content line and
 * the block is emitted.</li>
 * </ul>
 *
 * <p>
 * A {@link #timeout()} while collecting force-emits the buffered lines, and a
 * new start marker while collecting force-emits the stale block before
 * opening a new one. Blank lines are dropped and empty blocks are never
 * emitted.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. One instance belongs to one serial read loop.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrameAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(FrameAssembler.class);

    public static final String START_MARKER = "<ENDECSTART>";
    public static final String END_MARKER = "<ENDECEND>";

    /** Assembler states. */
    public enum State {
        SCANNING,
        COLLECTING
    }

    private State state = State.SCANNING;
    private final List<String> current = new ArrayList<>();

    /**
     * Feed one line of serial text.
     *
     * @param line a line without its terminator; {@code null} is ignored
     * @return blocks closed by this line, in order (usually zero or one)
     */
    public List<AlertBlock> accept(String line) {
        if (line == null) {
            return List.of();
        }
        List<AlertBlock> emitted = new ArrayList<>(1);
        String rest = line;

        while (rest != null) {
            if (state == State.SCANNING) {
                int start = rest.indexOf(START_MARKER);
                if (start < 0) {
                    if (LOG.isTraceEnabled() && !rest.isBlank()) {
                        LOG.trace("Discarding line outside alert block: {}", rest);
                    }
                    rest = null;
                } else {
                    state = State.COLLECTING;
                    LOG.debug("Alert block started");
                    rest = rest.substring(start + START_MARKER.length());
                }
                continue;
            }

            int end = rest.indexOf(END_MARKER);
            int start = rest.indexOf(START_MARKER);
            if (end >= 0 && (start < 0 || end < start)) {
                append(rest.substring(0, end));
                close(CloseReason.END_MARKER).ifPresent(emitted::add);
                rest = rest.substring(end + END_MARKER.length());
            } else if (start >= 0) {
                append(rest.substring(0, start));
                LOG.warn("Start marker arrived while a block was open; flushing {} buffered line(s)",
                        current.size());
                close(CloseReason.SUPERSEDED).ifPresent(emitted::add);
                state = State.COLLECTING;
                rest = rest.substring(start + START_MARKER.length());
            } else {
                append(rest);
                rest = null;
            }
        }
        return emitted;
    }

    /**
     * Signal that a read timed out with no new data.
     *
     * @return the force-emitted block if one was open and non-empty
     */
    public Optional<AlertBlock> timeout() {
        if (state != State.COLLECTING) {
            return Optional.empty();
        }
        LOG.warn("Read timed out inside an open alert block; flushing {} buffered line(s)", current.size());
        return close(CloseReason.TIMEOUT);
    }

    public State state() {
        return state;
    }

    /**
     * @return number of lines buffered in the open block
     */
    public int bufferedLines() {
        return current.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    // Kept verbatim: a line break can fall inside the space-padded sender field.
    private void append(String fragment) {
        if (fragment.isBlank()) {
            return;
        }
        LOG.debug("Line #{}: {}", current.size(), fragment);
        current.add(fragment);
    }

    private Optional<AlertBlock> close(CloseReason reason) {
        state = State.SCANNING;
        if (current.isEmpty()) {
            LOG.debug("Discarding empty alert block ({})", reason);
            return Optional.empty();
        }
        AlertBlock block = new AlertBlock(current, reason);
        current.clear();
        return Optional.of(block);
    }
}
