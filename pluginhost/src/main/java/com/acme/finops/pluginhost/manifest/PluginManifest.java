package com.acme.finops.pluginhost.manifest;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one installed plugin version.
 *
 * @param name               plugin name
 * @param version            plugin's own semantic version
 * @param specVersion        protocol spec version the plugin implements
 * @param supportedProviders cloud providers the plugin prices; {@code "*"} means any
 * @param binary             executable to launch
 * @param metadata           free-form string attributes
 * @param directory          version directory the manifest was read from
 */
public record PluginManifest(String name,
                             String version,
                             String specVersion,
                             List<String> supportedProviders,
                             Path binary,
                             Map<String, String> metadata,
                             Path directory) {

    public PluginManifest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(specVersion, "specVersion");
        Objects.requireNonNull(binary, "binary");
        supportedProviders = List.copyOf(supportedProviders == null ? List.of() : supportedProviders);
        metadata = Map.copyOf(metadata == null ? Map.of() : metadata);
        directory = directory == null ? binary.toAbsolutePath().getParent() : directory;
    }

    public PluginKey key() {
        return new PluginKey(name, version);
    }

    public boolean supportsProvider(String provider) {
        if (provider == null || provider.isBlank()) {
            return false;
        }
        String wanted = provider.trim().toLowerCase(Locale.ROOT);
        for (String p : supportedProviders) {
            if (p.equals("*") || p.toLowerCase(Locale.ROOT).equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    public String metadata(String key, String fallback) {
        return metadata.getOrDefault(key, fallback);
    }
}
