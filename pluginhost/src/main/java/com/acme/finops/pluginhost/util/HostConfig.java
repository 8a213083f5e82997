package com.acme.finops.pluginhost.util;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved host settings. Built once at startup and passed to the components that need it.
 *
 * @param pluginRoot          directory scanned for {@code <name>/<version>/manifest.json}
 * @param handshakeTimeout    bound on start-to-READY for one plugin
 * @param stopGrace           time between SIGTERM and forced kill
 * @param callTimeout         default per-call deadline used by the dispatcher
 * @param dispatchTimeout     umbrella deadline for one dispatch batch
 * @param strictCompatibility reject plugins whose spec version cannot be parsed
 * @param ioThreads           Netty event loop threads shared by all TCP channels
 */
public record HostConfig(Path pluginRoot,
                         Duration handshakeTimeout,
                         Duration stopGrace,
                         Duration callTimeout,
                         Duration dispatchTimeout,
                         boolean strictCompatibility,
                         int ioThreads) {

    public HostConfig {
        Objects.requireNonNull(pluginRoot, "pluginRoot");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(stopGrace, "stopGrace");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(dispatchTimeout, "dispatchTimeout");
        ioThreads = Math.max(1, ioThreads);
    }

    public static HostConfig defaults() {
        return fromEnv(Map.of());
    }

    public static HostConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static HostConfig fromEnv(Map<String, String> env) {
        Path defaultRoot = Path.of(System.getProperty("user.home"), ".finfocus", "plugins");
        return new HostConfig(
            EnvVars.getPath(env, PluginHostEnvKeys.FINFOCUS_PLUGIN_DIR, defaultRoot),
            EnvVars.getMillisClamped(env, PluginHostEnvKeys.FINFOCUS_HANDSHAKE_TIMEOUT_MS,
                PluginHostDefaults.DEFAULT_HANDSHAKE_TIMEOUT_MS, 100L, 120_000L),
            EnvVars.getMillisClamped(env, PluginHostEnvKeys.FINFOCUS_STOP_GRACE_MS,
                PluginHostDefaults.DEFAULT_STOP_GRACE_MS, 0L, 60_000L),
            EnvVars.getMillisClamped(env, PluginHostEnvKeys.FINFOCUS_CALL_TIMEOUT_MS,
                PluginHostDefaults.DEFAULT_CALL_TIMEOUT_MS, 10L, 600_000L),
            EnvVars.getMillisClamped(env, PluginHostEnvKeys.FINFOCUS_DISPATCH_TIMEOUT_MS,
                PluginHostDefaults.DEFAULT_DISPATCH_TIMEOUT_MS, 10L, 3_600_000L),
            EnvVars.getBoolean(env, PluginHostEnvKeys.FINFOCUS_STRICT_COMPATIBILITY, false),
            EnvVars.getIntClamped(env, PluginHostEnvKeys.FINFOCUS_IO_THREADS,
                PluginHostDefaults.DEFAULT_IO_THREADS, 1, 64)
        );
    }

    public HostConfig withHandshakeTimeout(Duration timeout) {
        return new HostConfig(pluginRoot, timeout, stopGrace, callTimeout, dispatchTimeout, strictCompatibility, ioThreads);
    }
}
