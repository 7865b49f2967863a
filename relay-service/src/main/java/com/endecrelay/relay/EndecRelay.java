package com.endecrelay.relay;

import com.endecrelay.core.decode.BlockResolver;
import com.endecrelay.core.decode.FrameAssembler;
import com.endecrelay.core.model.AlertBlock;
import com.endecrelay.core.model.EasHeader;
import com.endecrelay.core.model.ResolvedAlert;
import com.endecrelay.relay.health.HealthMonitor;
import com.endecrelay.relay.serial.LineSource;
import com.endecrelay.relay.sink.DispatchReport;
import com.endecrelay.relay.sink.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The relay loop: serial lines in, dispatched alerts out.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   LineSource (serial device)
 *     → FrameAssembler (start/end markers, timeout flush)
 *     → BlockResolver (header + message text)
 *     → Dispatcher (webhook, Discord, GroupMe, broker)
 * </pre>
 *
 * <p>
 * Every read timeout and every processed block gives the
 * {@link HealthMonitor} a chance to send a heartbeat. An {@link IOException}
 * from the source closes it and reopens it after {@code reconnectDelay}.
 * Shutdown is checked between reads; a block being dispatched is finished
 * first.
 * </p>
 *
 * @since 1.0.0
 */
public class EndecRelay implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(EndecRelay.class);

    private final LineSource source;
    private final FrameAssembler assembler;
    private final BlockResolver resolver;
    private final Dispatcher dispatcher;
    private final Optional<HealthMonitor> healthMonitor;
    private final Duration reconnectDelay;
    private final ShutdownSignal shutdown;

    private final AtomicLong alertsRelayed = new AtomicLong();

    /**
     * @param healthMonitor heartbeat monitor, or {@code null} when heartbeats
     *                      are disabled
     */
    public EndecRelay(LineSource source,
            FrameAssembler assembler,
            BlockResolver resolver,
            Dispatcher dispatcher,
            HealthMonitor healthMonitor,
            Duration reconnectDelay,
            ShutdownSignal shutdown) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.healthMonitor = Optional.ofNullable(healthMonitor);
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay must not be null");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown must not be null");
    }

    /**
     * Run until shutdown is requested. Runtime exceptions close the source and
     * propagate.
     */
    @Override
    public void run() {
        LOG.info("Relay started on {}", source.describe());
        while (!shutdown.isRequested()) {
            try {
                source.open();
                pump();
            } catch (IOException e) {
                LOG.error("Serial source {} failed: {}", source.describe(), e.getMessage(), e);
            } finally {
                source.close();
            }
            if (!shutdown.isRequested()) {
                LOG.info("Reconnecting to {} in {}s", source.describe(), reconnectDelay.toSeconds());
                shutdown.pause(reconnectDelay);
            }
        }
        LOG.info("Relay stopped after relaying {} alert(s)", alertsRelayed.get());
    }

    public long getAlertsRelayed() {
        return alertsRelayed.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void pump() throws IOException {
        while (!shutdown.isRequested()) {
            Optional<String> line = source.readLine();
            if (line.isEmpty()) {
                assembler.timeout().ifPresent(this::process);
                tickHealth();
                continue;
            }
            LOG.debug("Serial line: {}", line.get());
            for (AlertBlock block : assembler.accept(line.get())) {
                process(block);
            }
        }
    }

    private void process(AlertBlock block) {
        if (!block.isComplete()) {
            LOG.warn("Processing alert block closed by {} with {} line(s)",
                    block.getCloseReason(), block.getLines().size());
        }
        Optional<ResolvedAlert> resolved = resolver.resolve(block);
        if (resolved.isPresent()) {
            ResolvedAlert alert = resolved.get();
            LOG.info("Relaying alert: event={} length={}",
                    alert.getHeader().map(EasHeader::getEventCode).orElse("plain text"),
                    alert.getMessageText().length());
            DispatchReport report = dispatcher.dispatch(alert);
            alertsRelayed.incrementAndGet();
            if (report.allSucceeded()) {
                LOG.info("Alert delivered to {} sink(s)", report.getResults().size());
            } else {
                LOG.warn("Alert delivery incomplete: {}", report);
            }
        } else {
            LOG.debug("Alert block produced no text; skipped");
        }
        tickHealth();
    }

    private void tickHealth() {
        healthMonitor.ifPresent(HealthMonitor::tick);
    }
}
