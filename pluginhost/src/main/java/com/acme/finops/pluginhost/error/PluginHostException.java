package com.acme.finops.pluginhost.error;

import java.util.Objects;

/**
 * Checked failure raised by host-side operations. Carries the taxonomy kind and, for process
 * failures, the captured child output.
 */
public class PluginHostException extends Exception {
    private final ErrorKind kind;
    private final String diagnostics;

    public PluginHostException(ErrorKind kind, String message) {
        this(kind, message, "", null);
    }

    public PluginHostException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, "", cause);
    }

    public PluginHostException(ErrorKind kind, String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Captured stdout/stderr of the plugin process at the time of failure, empty when not applicable.
     */
    public String diagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
