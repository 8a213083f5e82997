package com.acme.finops.pluginhost.conformance;

import java.util.Locale;

public enum TestStatus {
    PASS,
    FAIL,
    SKIP,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TestStatus parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("test status is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
