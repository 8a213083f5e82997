package com.acme.finops.pluginhost.testing;

import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.process.PluginHandle;
import com.acme.finops.pluginhost.process.PluginState;
import com.acme.finops.pluginhost.rpc.CostSourceClient;
import com.acme.finops.pluginhost.transport.api.CommMode;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Plugin handle backed by a {@link ScriptedRpcChannel} instead of a process.
 */
public final class StubPluginHandle implements PluginHandle {
    private static final AtomicLong IDS = new AtomicLong();

    private final long handleId = IDS.incrementAndGet();
    private final PluginManifest manifest;
    private final ScriptedRpcChannel channel;
    private final CostSourceClient client;
    private volatile PluginState state = PluginState.READY;

    public StubPluginHandle(String name, List<String> providers, Map<String, String> metadata, ScriptedRpcChannel channel) {
        this.manifest = new PluginManifest(name, "1.0.0", "1.0.0", providers, Path.of("/opt/plugins", name, "1.0.0", name),
            metadata, null);
        this.channel = channel;
        this.client = new CostSourceClient(name, channel, this::isReady);
    }

    public static StubPluginHandle aws(String name, ScriptedRpcChannel channel) {
        return new StubPluginHandle(name, List.of("aws"), Map.of(), channel);
    }

    public void setState(PluginState state) {
        this.state = state;
    }

    public ScriptedRpcChannel channel() {
        return channel;
    }

    @Override
    public long handleId() {
        return handleId;
    }

    @Override
    public PluginManifest manifest() {
        return manifest;
    }

    @Override
    public CommMode mode() {
        return CommMode.TCP;
    }

    @Override
    public PluginState state() {
        return state;
    }

    @Override
    public CostSourceClient client() {
        return client;
    }

    @Override
    public Optional<PluginInfo> pluginInfo() {
        return Optional.of(new PluginInfo(manifest.name(), manifest.version(), manifest.specVersion(),
            manifest.supportedProviders(), manifest.metadata()));
    }
}
