package com.acme.finops.pluginhost.conformance;

import java.util.Locale;

public enum OutputFormat {
    TABLE,
    JSON,
    JUNIT;

    public static OutputFormat parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("output format is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "table" -> TABLE;
            case "json" -> JSON;
            case "junit" -> JUNIT;
            default -> throw new IllegalArgumentException("unknown output format: " + raw + " (expected table, json or junit)");
        };
    }
}
