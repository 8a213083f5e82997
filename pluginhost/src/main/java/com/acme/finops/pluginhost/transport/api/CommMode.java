package com.acme.finops.pluginhost.transport.api;

import java.util.Locale;

/**
 * How the host talks to a plugin process.
 */
public enum CommMode {
    /** Plugin listens on a loopback port announced through its handshake line. */
    TCP("--mode=tcp"),
    /** Plugin reads requests on stdin and writes responses on stdout. */
    STDIO("--stdio");

    private final String launchFlag;

    CommMode(String launchFlag) {
        this.launchFlag = launchFlag;
    }

    public String launchFlag() {
        return launchFlag;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CommMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("communication mode is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "tcp" -> TCP;
            case "stdio" -> STDIO;
            default -> throw new IllegalArgumentException("unknown communication mode: " + raw + " (expected tcp or stdio)");
        };
    }
}
