package com.acme.finops.pluginhost.ci;

import com.acme.finops.pluginhost.conformance.Verbosity;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Maps conformance verbosity onto the JUL root logger and its handlers.
 */
public final class LogLevels {
    private LogLevels() {
    }

    /**
     * Loads the bundled {@code logging.properties} unless the JVM was given its own configuration.
     */
    public static void loadBundledConfig() {
        if (System.getProperty("java.util.logging.config.file") != null
            || System.getProperty("java.util.logging.config.class") != null) {
            return;
        }
        try (InputStream in = LogLevels.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LogLevels.class.getName()).log(Level.WARNING, "cannot load bundled logging.properties", e);
        }
    }

    public static Level levelFor(Verbosity verbosity) {
        return switch (verbosity) {
            case QUIET -> Level.WARNING;
            case NORMAL -> Level.INFO;
            case VERBOSE -> Level.FINE;
            case DEBUG -> Level.FINEST;
        };
    }

    public static void apply(Verbosity verbosity) {
        Level level = levelFor(verbosity);
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
