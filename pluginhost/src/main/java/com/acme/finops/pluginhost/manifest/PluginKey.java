package com.acme.finops.pluginhost.manifest;

import java.util.Objects;

public record PluginKey(String name, String version) {
    public PluginKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
