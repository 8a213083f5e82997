package com.acme.finops.pluginhost.wire;

import com.acme.finops.pluginhost.util.PluginHostDefaults;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Blocking codec for length-prefixed frames: a 4-byte big-endian payload length followed by the payload.
 * Used on pipes; the TCP path uses the equivalent Netty length-field handlers.
 */
public final class FrameCodec {
    public static final int LENGTH_FIELD_BYTES = 4;

    private FrameCodec() {
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        if (payload.length > PluginHostDefaults.MAX_FRAME_BYTES) {
            throw new WireFormatException("frame too large: " + payload.length);
        }
        byte[] header = new byte[LENGTH_FIELD_BYTES];
        int len = payload.length;
        header[0] = (byte) (len >>> 24);
        header[1] = (byte) (len >>> 16);
        header[2] = (byte) (len >>> 8);
        header[3] = (byte) len;
        out.write(header);
        out.write(payload);
        out.flush();
    }

    /**
     * Reads one frame.
     *
     * @return the payload, or {@code null} on a clean end of stream before any header byte
     */
    public static byte[] readFrame(InputStream in) throws IOException {
        int b0 = in.read();
        if (b0 < 0) {
            return null;
        }
        byte[] rest = in.readNBytes(LENGTH_FIELD_BYTES - 1);
        if (rest.length < LENGTH_FIELD_BYTES - 1) {
            throw new EOFException("truncated frame header");
        }
        int len = (b0 << 24) | ((rest[0] & 0xFF) << 16) | ((rest[1] & 0xFF) << 8) | (rest[2] & 0xFF);
        if (len < 0 || len > PluginHostDefaults.MAX_FRAME_BYTES) {
            throw new WireFormatException("invalid frame length: " + len);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length < len) {
            throw new EOFException("truncated frame payload: expected=" + len + " actual=" + payload.length);
        }
        return payload;
    }
}
