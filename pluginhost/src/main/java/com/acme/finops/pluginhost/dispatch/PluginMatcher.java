package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.ResourceDescriptor;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a plugin should be asked about a resource.
 *
 * <p>The provider must be in the manifest's supported providers ({@code *} matches all). If the manifest
 * metadata carries {@code resource_types}, a comma-separated list of globs where {@code *} matches any
 * run of characters, the resource type must match one of them.</p>
 */
public final class PluginMatcher {
    public static final String RESOURCE_TYPES_KEY = "resource_types";

    private PluginMatcher() {
    }

    public static boolean matches(PluginManifest manifest, ResourceDescriptor resource) {
        if (!manifest.supportsProvider(resource.effectiveProvider())) {
            return false;
        }
        String types = manifest.metadata().get(RESOURCE_TYPES_KEY);
        if (types == null || types.isBlank()) {
            return true;
        }
        String type = resource.resourceType().toLowerCase(Locale.ROOT);
        for (String glob : types.split(",")) {
            String g = glob.trim().toLowerCase(Locale.ROOT);
            if (!g.isEmpty() && globMatches(g, type)) {
                return true;
            }
        }
        return false;
    }

    static boolean globMatches(String glob, String value) {
        String[] parts = glob.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(parts[i]));
        }
        return Pattern.matches(regex.toString(), value);
    }
}
