package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.transport.api.RpcTransportException;
import com.acme.finops.pluginhost.wire.WireErrorCodes;
import com.acme.finops.pluginhost.wire.WireFormatException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps every failure a transport can produce onto the host taxonomy.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static PluginRpcException classify(Throwable error, String pluginName, String method) {
        Throwable t = unwrap(error);
        if (t instanceof PluginRpcException rpc) {
            return rpc;
        }
        if (t instanceof RpcTransportException transport) {
            ErrorKind kind = switch (transport.failure()) {
                case CONNECT_FAILED, CLOSED -> ErrorKind.UNAVAILABLE;
                case DEADLINE_EXCEEDED -> ErrorKind.TIMEOUT;
                case MALFORMED -> ErrorKind.PROTOCOL_MISMATCH;
                case REMOTE_ERROR -> fromWireCode(transport.remoteCode());
            };
            return new PluginRpcException(kind, pluginName, method, transport.getMessage(), transport);
        }
        if (t instanceof CancellationException) {
            return new PluginRpcException(ErrorKind.CANCELLED, pluginName, method, "call cancelled", t);
        }
        if (t instanceof TimeoutException) {
            return new PluginRpcException(ErrorKind.TIMEOUT, pluginName, method, "deadline exceeded", t);
        }
        if (t instanceof InterruptedException) {
            return new PluginRpcException(ErrorKind.CANCELLED, pluginName, method, "caller interrupted", t);
        }
        if (t instanceof WireFormatException) {
            return new PluginRpcException(ErrorKind.PROTOCOL_MISMATCH, pluginName, method,
                "malformed payload: " + t.getMessage(), t);
        }
        return new PluginRpcException(ErrorKind.INTERNAL, pluginName, method, String.valueOf(t.getMessage()), t);
    }

    public static ErrorKind fromWireCode(String code) {
        if (code == null) {
            return ErrorKind.INTERNAL;
        }
        return switch (code) {
            case WireErrorCodes.NOT_SUPPORTED, WireErrorCodes.UNIMPLEMENTED, WireErrorCodes.NOT_FOUND -> ErrorKind.NOT_SUPPORTED;
            case WireErrorCodes.NO_DATA -> ErrorKind.NO_DATA;
            case WireErrorCodes.INVALID_ARGUMENT -> ErrorKind.INVALID_ARGUMENT;
            case WireErrorCodes.UNAVAILABLE -> ErrorKind.UNAVAILABLE;
            case WireErrorCodes.DEADLINE_EXCEEDED -> ErrorKind.TIMEOUT;
            case WireErrorCodes.CANCELLED -> ErrorKind.CANCELLED;
            default -> ErrorKind.INTERNAL;
        };
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
