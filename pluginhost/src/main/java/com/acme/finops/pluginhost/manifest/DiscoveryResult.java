package com.acme.finops.pluginhost.manifest;

import java.util.List;

public record DiscoveryResult(List<PluginManifest> manifests, List<DiscoveryIssue> issues) {
    public DiscoveryResult {
        manifests = List.copyOf(manifests);
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
