package com.acme.finops.pluginhost.transport.api;

import java.util.Objects;

/**
 * Raw transport-level failure. Never leaves the adapter: it is reclassified into the host taxonomy first.
 */
public final class RpcTransportException extends RuntimeException {
    private final TransportFailure failure;
    private final String remoteCode;

    public RpcTransportException(TransportFailure failure, String message) {
        this(failure, null, message, null);
    }

    public RpcTransportException(TransportFailure failure, String message, Throwable cause) {
        this(failure, null, message, cause);
    }

    public RpcTransportException(TransportFailure failure, String remoteCode, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.remoteCode = remoteCode;
    }

    public static RpcTransportException remote(String code, String message) {
        return new RpcTransportException(TransportFailure.REMOTE_ERROR, code, message, null);
    }

    public TransportFailure failure() {
        return failure;
    }

    /**
     * Error code reported by the plugin, present only for {@link TransportFailure#REMOTE_ERROR}.
     */
    public String remoteCode() {
        return remoteCode;
    }
}
