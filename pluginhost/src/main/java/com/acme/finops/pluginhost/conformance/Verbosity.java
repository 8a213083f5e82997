package com.acme.finops.pluginhost.conformance;

import java.util.Locale;

public enum Verbosity {
    QUIET,
    NORMAL,
    VERBOSE,
    DEBUG;

    public static Verbosity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("verbosity is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "quiet" -> QUIET;
            case "normal" -> NORMAL;
            case "verbose" -> VERBOSE;
            case "debug" -> DEBUG;
            default -> throw new IllegalArgumentException("unknown verbosity: " + raw
                + " (expected quiet, normal, verbose or debug)");
        };
    }
}
