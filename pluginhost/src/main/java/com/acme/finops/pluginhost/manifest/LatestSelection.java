package com.acme.finops.pluginhost.manifest;

import java.util.List;

/**
 * Highest version per plugin name, plus one warning per entry whose version could not be ranked.
 */
public record LatestSelection(List<PluginManifest> latest, List<String> warnings) {
    public LatestSelection {
        latest = List.copyOf(latest);
        warnings = List.copyOf(warnings);
    }
}
