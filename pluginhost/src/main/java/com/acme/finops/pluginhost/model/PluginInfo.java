package com.acme.finops.pluginhost.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Self-description returned by {@code GetPluginInfo}.
 */
public record PluginInfo(String name,
                         String version,
                         String specVersion,
                         List<String> providers,
                         Map<String, String> metadata) {
    public PluginInfo {
        Objects.requireNonNull(name, "name");
        version = version == null ? "" : version;
        specVersion = specVersion == null ? "" : specVersion;
        providers = List.copyOf(providers == null ? List.of() : providers);
        metadata = Map.copyOf(metadata == null ? Map.of() : metadata);
    }

    public boolean declares(String metadataKey) {
        return Boolean.parseBoolean(metadata.getOrDefault(metadataKey, "false").trim());
    }
}
