package com.acme.finops.pluginhost.wire;

import com.acme.finops.pluginhost.util.PluginHostDefaults;

import java.util.Objects;

/**
 * First stdout line of a TCP-mode plugin: {@code FINFOCUS_PLUGIN|<spec_version>|tcp|<host>:<port>}.
 */
public record HandshakeLine(String specVersion, String transport, String host, int port) {
    private static final String SEPARATOR = "|";

    public HandshakeLine {
        Objects.requireNonNull(specVersion, "specVersion");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(host, "host");
    }

    public static boolean looksLikeHandshake(String line) {
        return line != null && line.startsWith(PluginHostDefaults.HANDSHAKE_PREFIX + SEPARATOR);
    }

    public static HandshakeLine parse(String line) throws WireFormatException {
        if (!looksLikeHandshake(line)) {
            throw new WireFormatException("not a handshake line: " + line);
        }
        String[] parts = line.trim().split("\\|", -1);
        if (parts.length != 4) {
            throw new WireFormatException("handshake must have 4 fields: " + line);
        }
        String spec = parts[1].trim();
        String transport = parts[2].trim();
        if (spec.isEmpty()) {
            throw new WireFormatException("handshake without spec version: " + line);
        }
        if (!transport.equals("tcp")) {
            throw new WireFormatException("unsupported handshake transport: " + transport);
        }
        String address = parts[3].trim();
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new WireFormatException("handshake address must be host:port: " + address);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new WireFormatException("handshake port is not numeric: " + address, e);
        }
        if (port < 1 || port > 65_535) {
            throw new WireFormatException("handshake port out of range: " + port);
        }
        return new HandshakeLine(spec, transport, address.substring(0, colon), port);
    }

    public String format() {
        return PluginHostDefaults.HANDSHAKE_PREFIX + SEPARATOR + specVersion + SEPARATOR + transport
            + SEPARATOR + host + ":" + port;
    }
}
