package com.acme.finops.pluginhost.error;

/**
 * Failure taxonomy shared by the supervisor, the adapter, the dispatcher and discovery.
 */
public enum ErrorKind {
    HANDSHAKE_TIMEOUT,
    PROTOCOL_MISMATCH,
    NOT_SUPPORTED,
    NO_DATA,
    INVALID_ARGUMENT,
    TIMEOUT,
    UNAVAILABLE,
    MIXED_CURRENCIES,
    MALFORMED_MANIFEST,
    VERSION_CONFLICT,
    CANCELLED,
    INTERNAL;

    /**
     * Kinds that mean the plugin process itself is gone or unreachable, as opposed to a per-request refusal.
     */
    public boolean isProcessFault() {
        return this == UNAVAILABLE || this == HANDSHAKE_TIMEOUT;
    }
}
