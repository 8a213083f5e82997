package com.acme.finops.pluginhost.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HostConfigTest {

    @Test
    void shouldUseDefaultsWhenEnvironmentIsEmpty() {
        HostConfig config = HostConfig.fromEnv(Map.of());
        assertEquals(Duration.ofMillis(PluginHostDefaults.DEFAULT_HANDSHAKE_TIMEOUT_MS), config.handshakeTimeout());
        assertEquals(Duration.ofMillis(PluginHostDefaults.DEFAULT_CALL_TIMEOUT_MS), config.callTimeout());
        assertEquals(Duration.ofMillis(PluginHostDefaults.DEFAULT_DISPATCH_TIMEOUT_MS), config.dispatchTimeout());
        assertFalse(config.strictCompatibility());
        assertEquals(Path.of(System.getProperty("user.home"), ".finfocus", "plugins"), config.pluginRoot());
    }

    @Test
    void shouldReadAndClampEnvironmentOverrides() {
        HostConfig config = HostConfig.fromEnv(Map.of(
            PluginHostEnvKeys.FINFOCUS_PLUGIN_DIR, "/tmp/plugins",
            PluginHostEnvKeys.FINFOCUS_HANDSHAKE_TIMEOUT_MS, "1",
            PluginHostEnvKeys.FINFOCUS_CALL_TIMEOUT_MS, "2500",
            PluginHostEnvKeys.FINFOCUS_STRICT_COMPATIBILITY, "true",
            PluginHostEnvKeys.FINFOCUS_IO_THREADS, "1000"
        ));
        assertEquals(Path.of("/tmp/plugins"), config.pluginRoot());
        assertEquals(Duration.ofMillis(100), config.handshakeTimeout());
        assertEquals(Duration.ofMillis(2500), config.callTimeout());
        assertTrue(config.strictCompatibility());
        assertEquals(64, config.ioThreads());
    }

    @Test
    void shouldReplaceSingleTimeouts() {
        HostConfig config = HostConfig.defaults().withHandshakeTimeout(Duration.ofSeconds(9));
        assertEquals(Duration.ofSeconds(9), config.handshakeTimeout());
        assertEquals(HostConfig.defaults().callTimeout(), config.callTimeout());
    }
}
