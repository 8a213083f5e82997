package com.acme.finops.pluginhost.model;

import java.util.Locale;

public enum FieldMappingStatus {
    SUPPORTED,
    UNSUPPORTED,
    CONDITIONAL,
    DYNAMIC;

    public static FieldMappingStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("field mapping status is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
