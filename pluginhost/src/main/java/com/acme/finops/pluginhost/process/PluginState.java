package com.acme.finops.pluginhost.process;

public enum PluginState {
    STARTING,
    HANDSHAKING,
    READY,
    /** Alive and answering identity, but self-description failed; not eligible for dispatch. */
    DEGRADED,
    CRASHED,
    STOPPED;

    public boolean isTerminal() {
        return this == CRASHED || this == STOPPED;
    }
}
