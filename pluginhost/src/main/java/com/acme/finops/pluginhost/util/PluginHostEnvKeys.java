package com.acme.finops.pluginhost.util;

/**
 * Canonical environment variable names read by the plugin host.
 */
public final class PluginHostEnvKeys {
    public static final String FINFOCUS_PLUGIN_DIR = "FINFOCUS_PLUGIN_DIR";
    public static final String FINFOCUS_HANDSHAKE_TIMEOUT_MS = "FINFOCUS_HANDSHAKE_TIMEOUT_MS";
    public static final String FINFOCUS_STOP_GRACE_MS = "FINFOCUS_STOP_GRACE_MS";
    public static final String FINFOCUS_CALL_TIMEOUT_MS = "FINFOCUS_CALL_TIMEOUT_MS";
    public static final String FINFOCUS_DISPATCH_TIMEOUT_MS = "FINFOCUS_DISPATCH_TIMEOUT_MS";
    public static final String FINFOCUS_STRICT_COMPATIBILITY = "FINFOCUS_STRICT_COMPATIBILITY";
    public static final String FINFOCUS_IO_THREADS = "FINFOCUS_IO_THREADS";

    // Passed to children so a plugin knows which transport it was launched for.
    public static final String FINFOCUS_PLUGIN_MODE = "FINFOCUS_PLUGIN_MODE";

    // Opt-in credentials marker for conformance cases that hit a real billing backend.
    public static final String FINFOCUS_CONFORMANCE_CREDENTIALS = "FINFOCUS_CONFORMANCE_CREDENTIALS";

    private PluginHostEnvKeys() {
    }
}
