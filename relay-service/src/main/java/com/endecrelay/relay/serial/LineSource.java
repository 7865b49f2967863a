package com.endecrelay.relay.serial;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A reopenable source of text lines with a read timeout.
 *
 * @since 1.0.0
 */
public interface LineSource extends Closeable {

    /**
     * Open (or reopen) the underlying device.
     *
     * @throws IOException if the device cannot be opened
     */
    void open() throws IOException;

    /**
     * Read the next complete line, without its terminator.
     *
     * @return the line, or empty if the read timeout elapsed first
     * @throws java.io.EOFException if the device reported end of stream
     * @throws IOException          on any other device failure
     */
    Optional<String> readLine() throws IOException;

    /**
     * @return a short description for log messages, e.g. the device path
     */
    String describe();

    /**
     * Release the device. Safe to call when not open.
     */
    @Override
    void close();
}
