package com.acme.finops.pluginhost.wire;

import java.io.IOException;

/**
 * Bytes on the wire that do not form a valid frame, envelope or handshake line.
 */
public final class WireFormatException extends IOException {
    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
