package com.acme.finops.pluginhost.conformance;

/**
 * Thrown from a case body when the plugin legitimately lacks the feature under test.
 */
public final class CaseSkipped extends Exception {
    public CaseSkipped(String reason) {
        super(reason);
    }
}
