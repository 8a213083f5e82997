package com.acme.finops.pluginhost.util;

/**
 * Default timeout, limit, and protocol constants for the plugin host.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class PluginHostDefaults {

    // ---- Protocol ----
    public static final String HOST_SPEC_VERSION = "1.0.0";
    public static final String HANDSHAKE_PREFIX = "FINFOCUS_PLUGIN";
    public static final String MANIFEST_FILE_NAME = "manifest.json";
    public static final String BINARY_PREFIX = "finfocus-plugin-";

    // ---- Process lifecycle ----
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_STOP_GRACE_MS = 2_000L;
    public static final long REAP_TIMEOUT_MS = 5_000L;
    public static final int OUTPUT_CAPTURE_LINES = 200;

    // ---- Calls ----
    public static final long DEFAULT_CALL_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_DISPATCH_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 3_000;
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    // ---- Conformance ----
    public static final long DEFAULT_TEST_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_SUITE_TIMEOUT_MS = 5 * 60_000L;
    public static final String CONFORMANCE_SUITE_NAME = "conformance";
    public static final String JUNIT_SUITES_NAME = "finfocus-conformance";

    // ---- Netty ----
    public static final int DEFAULT_IO_THREADS = 2;

    private PluginHostDefaults() {
    }
}
