package com.acme.finops.pluginhost.process;

import com.acme.finops.pluginhost.manifest.PluginKey;
import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.rpc.CostSourceClient;
import com.acme.finops.pluginhost.transport.api.CommMode;

import java.util.Optional;

/**
 * Live plugin as seen by consumers: identity, lifecycle state and the typed client.
 */
public interface PluginHandle {

    /**
     * Unique per start; a restarted plugin gets a new id.
     */
    long handleId();

    PluginManifest manifest();

    CommMode mode();

    PluginState state();

    CostSourceClient client();

    Optional<PluginInfo> pluginInfo();

    default PluginKey key() {
        return manifest().key();
    }

    default String name() {
        return manifest().name();
    }

    default boolean isReady() {
        return state() == PluginState.READY;
    }
}
