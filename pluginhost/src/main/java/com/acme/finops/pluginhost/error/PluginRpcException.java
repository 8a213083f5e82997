package com.acme.finops.pluginhost.error;

/**
 * Failure of one adapter call. The plugin name identifies which side of a fan-out failed.
 */
public final class PluginRpcException extends PluginHostException {
    private final String pluginName;
    private final String method;

    public PluginRpcException(ErrorKind kind, String pluginName, String method, String message) {
        this(kind, pluginName, method, message, null);
    }

    public PluginRpcException(ErrorKind kind, String pluginName, String method, String message, Throwable cause) {
        super(kind, pluginName + "." + method + ": " + message, cause);
        this.pluginName = pluginName;
        this.method = method;
    }

    public String pluginName() {
        return pluginName;
    }

    public String method() {
        return method;
    }
}
