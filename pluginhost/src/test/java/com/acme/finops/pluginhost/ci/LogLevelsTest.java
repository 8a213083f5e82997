package com.acme.finops.pluginhost.ci;

import com.acme.finops.pluginhost.conformance.Verbosity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LogLevelsTest {

    @AfterEach
    void restore() {
        LogLevels.apply(Verbosity.NORMAL);
    }

    @Test
    void shouldMapVerbosityToJulLevels() {
        assertEquals(Level.WARNING, LogLevels.levelFor(Verbosity.QUIET));
        assertEquals(Level.INFO, LogLevels.levelFor(Verbosity.NORMAL));
        assertEquals(Level.FINE, LogLevels.levelFor(Verbosity.VERBOSE));
        assertEquals(Level.FINEST, LogLevels.levelFor(Verbosity.DEBUG));
    }

    @Test
    void shouldApplyLevelToRootLogger() {
        LogLevels.apply(Verbosity.DEBUG);

        assertEquals(Level.FINEST, Logger.getLogger("").getLevel());
    }
}
