package com.endecrelay.relay.serial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a byte stream into lines on {@code '\n'}.
 *
 * <p>
 * Lines are decoded as UTF-8 with malformed input replaced, and carriage
 * returns are removed. Bytes after the last newline stay buffered until more
 * input arrives, so a read timeout never splits a line. A run of
 * {@code maxLineBytes} bytes with no newline is emitted as a line of its own,
 * which bounds the buffer on a noisy or mis-configured link.
 * </p>
 */
public class LineBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(LineBuffer.class);

    /** Default cap on bytes held while waiting for a newline. */
    public static final int DEFAULT_MAX_LINE_BYTES = 4096;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final int maxLineBytes;

    public LineBuffer() {
        this(DEFAULT_MAX_LINE_BYTES);
    }

    public LineBuffer(int maxLineBytes) {
        if (maxLineBytes < 1) {
            throw new IllegalArgumentException("maxLineBytes must be >= 1, got: " + maxLineBytes);
        }
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * Append bytes and return every line they complete.
     */
    public List<String> append(byte[] data, int length) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            byte b = data[i];
            if (b == '\n') {
                lines.add(decode(pending.toByteArray()));
                pending.reset();
            } else if (b != '\r') {
                pending.write(b);
                if (pending.size() >= maxLineBytes) {
                    LOG.warn("No line terminator after {} bytes; emitting them as one line", maxLineBytes);
                    lines.add(decode(pending.toByteArray()));
                    pending.reset();
                }
            }
        }
        return lines;
    }

    /**
     * @return number of bytes waiting for a newline
     */
    public int pendingBytes() {
        return pending.size();
    }

    public void clear() {
        pending.reset();
    }

    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
