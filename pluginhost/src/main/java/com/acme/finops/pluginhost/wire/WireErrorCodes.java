package com.acme.finops.pluginhost.wire;

/**
 * Error codes a plugin may put in a response's {@code error.code} field.
 */
public final class WireErrorCodes {
    public static final String NOT_SUPPORTED = "NOT_SUPPORTED";
    public static final String UNIMPLEMENTED = "UNIMPLEMENTED";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String NO_DATA = "NO_DATA";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String UNAVAILABLE = "UNAVAILABLE";
    public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";
    public static final String CANCELLED = "CANCELLED";
    public static final String INTERNAL = "INTERNAL";

    private WireErrorCodes() {
    }
}
