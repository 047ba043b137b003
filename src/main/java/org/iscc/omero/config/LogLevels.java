package org.iscc.omero.config;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Service log level given as {@code debug}, {@code info}, {@code warning}, {@code error} or
 * {@code critical}, applied to the {@code org.iscc} category at startup.
 */
public final class LogLevels {

    public static final String CATEGORY = "org.iscc";

    // Held so the configured level is not lost with a collected logger
    private static final Logger SERVICE_LOGGER = Logger.getLogger(CATEGORY);

    private LogLevels() {
    }

    public static Optional<Level> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "debug":
                return Optional.of(Level.FINE);
            case "info":
                return Optional.of(Level.INFO);
            case "warn":
            case "warning":
                return Optional.of(Level.WARNING);
            case "error":
            case "critical":
                return Optional.of(Level.SEVERE);
            default:
                return Optional.empty();
        }
    }

    public static void apply(Level level) {
        SERVICE_LOGGER.setLevel(level);
    }

    public static Level current() {
        return SERVICE_LOGGER.getLevel();
    }
}
