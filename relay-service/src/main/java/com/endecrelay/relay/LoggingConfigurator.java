package com.endecrelay.relay;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Raises the Logback root level at runtime when the {@code debug} flag is set.
 *
 * <p>
 * Other SLF4J bindings keep their own configuration; a warning names the
 * backend that could not be adjusted.
 * </p>
 *
 * @since 1.0.0
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
        // utility class, not instantiable
    }

    /**
     * Set the root logger to DEBUG.
     *
     * @return {@code true} if the level was applied
     */
    public static boolean enableDebugLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            if (!Level.DEBUG.equals(root.getLevel())) {
                root.setLevel(Level.DEBUG);
                LOG.debug("Debug logging enabled");
            }
            return true;
        }
        LOG.warn("Debug logging requested but backend {} does not support dynamic level updates",
                factory.getClass().getName());
        return false;
    }
}
