package com.endecrelay.relay.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.fazecast.jSerialComm.SerialPortTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LineSource} backed by a serial port via jSerialComm.
 *
 * <p>
 * The port is opened 8N1 at the configured baud rate in semi-blocking read
 * mode, so {@link #readLine()} returns empty once the read timeout passes
 * without a complete line.
 * </p>
 *
 * @since 1.0.0
 */
public class SerialLineSource implements LineSource {

    private static final Logger LOG = LoggerFactory.getLogger(SerialLineSource.class);

    private final String portName;
    private final int baudRate;
    private final Duration readTimeout;

    private final LineBuffer buffer = new LineBuffer();
    private final Deque<String> ready = new ArrayDeque<>();
    private final byte[] chunk = new byte[256];

    private SerialPort port;
    private InputStream input;

    public SerialLineSource(String portName, int baudRate, Duration readTimeout) {
        this.portName = Objects.requireNonNull(portName, "portName must not be null");
        this.baudRate = baudRate;
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout must not be null");
    }

    @Override
    public void open() throws IOException {
        close();
        SerialPort candidate = SerialPort.getCommPort(portName);
        candidate.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        candidate.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING, (int) readTimeout.toMillis(), 0);
        if (!candidate.openPort()) {
            throw new IOException("Unable to open serial port " + portName
                    + " (error code " + candidate.getLastErrorCode() + ")");
        }
        port = candidate;
        input = candidate.getInputStream();
        LOG.info("Opened serial port {} at {} baud, 8N1", portName, baudRate);
    }

    @Override
    public Optional<String> readLine() throws IOException {
        if (!ready.isEmpty()) {
            return Optional.of(ready.poll());
        }
        if (input == null) {
            throw new IOException("Serial port " + portName + " is not open");
        }
        while (true) {
            int n;
            try {
                n = input.read(chunk, 0, chunk.length);
            } catch (SerialPortTimeoutException e) {
                return Optional.empty();
            }
            if (n < 0) {
                throw new EOFException("Serial port " + portName + " reached end of stream");
            }
            if (n == 0) {
                return Optional.empty();
            }
            ready.addAll(buffer.append(chunk, n));
            if (!ready.isEmpty()) {
                return Optional.of(ready.poll());
            }
        }
    }

    @Override
    public String describe() {
        return portName;
    }

    @Override
    public void close() {
        if (port != null) {
            if (!port.closePort()) {
                LOG.warn("Serial port {} did not close cleanly", portName);
            }
            LOG.info("Closed serial port {}", portName);
        }
        port = null;
        input = null;
        ready.clear();
        buffer.clear();
    }
}
