package com.acme.finops.pluginhost.conformance;

import java.util.Locale;

public enum TestCategory {
    PROTOCOL,
    COST,
    ERROR,
    RECOMMENDATION,
    DRYRUN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TestCategory parse(String raw) {
        if (raw != null) {
            for (TestCategory c : values()) {
                if (c.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("unknown test category: " + raw
            + " (expected protocol, cost, error, recommendation or dryrun)");
    }
}
