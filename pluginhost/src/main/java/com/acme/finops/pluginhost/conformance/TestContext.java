package com.acme.finops.pluginhost.conformance;

import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.model.PropertyBag;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import com.acme.finops.pluginhost.process.PluginHandle;
import com.acme.finops.pluginhost.rpc.CostSourceClient;
import com.acme.finops.pluginhost.util.Deadline;

import java.util.Map;
import java.util.Optional;

/**
 * What a case body may use: the plugin under test, the case deadline and the run environment.
 */
public final class TestContext {
    static final String SAMPLE_TYPE_KEY = "conformance_resource_type";
    static final String DEFAULT_SAMPLE_TYPE = "aws:ec2/instance:Instance";

    private final PluginHandle handle;
    private final Deadline deadline;
    private final Map<String, String> environment;
    private final String hostSpecVersion;

    TestContext(PluginHandle handle, Deadline deadline, Map<String, String> environment, String hostSpecVersion) {
        this.handle = handle;
        this.deadline = deadline;
        this.environment = environment;
        this.hostSpecVersion = hostSpecVersion;
    }

    public CostSourceClient client() {
        return handle.client();
    }

    public Deadline deadline() {
        return deadline;
    }

    public Optional<PluginInfo> pluginInfo() {
        return handle.pluginInfo();
    }

    public String hostSpecVersion() {
        return hostSpecVersion;
    }

    public Optional<String> env(String key) {
        String v = environment.get(key);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }

    /**
     * Metadata flag declared by the plugin, from {@code GetPluginInfo} or, failing that, its manifest.
     */
    public boolean declares(String metadataKey) {
        return pluginInfo().map(i -> i.declares(metadataKey))
            .orElse(Boolean.parseBoolean(handle.manifest().metadata(metadataKey, "false")));
    }

    /**
     * A resource the plugin should be able to price. Plugins that do not price the default AWS instance
     * name their own type through the {@code conformance_resource_type} metadata key.
     */
    public ResourceDescriptor sampleResource() {
        String type = pluginInfo().map(i -> i.metadata().get(SAMPLE_TYPE_KEY))
            .orElse(handle.manifest().metadata(SAMPLE_TYPE_KEY, null));
        if (type == null || type.isBlank()) {
            type = DEFAULT_SAMPLE_TYPE;
        }
        return new ResourceDescriptor("conformance-sample", "", type,
            PropertyBag.of(Map.of("instanceType", "t3.micro", "region", "us-east-1")));
    }
}
