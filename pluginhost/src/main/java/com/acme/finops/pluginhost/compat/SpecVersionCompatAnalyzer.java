package com.acme.finops.pluginhost.compat;

import java.util.Optional;

/**
 * Spec versions are compatible when their major components match. Minor and patch drift is tolerated
 * in both directions.
 */
public final class SpecVersionCompatAnalyzer implements CompatAnalyzer {

    @Override
    public CompatResult analyze(String hostSpecVersion, String pluginSpecVersion) {
        Optional<SemanticVersion> host = SemanticVersion.parse(hostSpecVersion);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host spec version is not semantic: " + hostSpecVersion);
        }
        Optional<SemanticVersion> plugin = SemanticVersion.parse(pluginSpecVersion);
        if (plugin.isEmpty()) {
            return new CompatResult.Invalid(pluginSpecVersion, "not a semantic version");
        }
        if (host.get().major() != plugin.get().major()) {
            return new CompatResult.MajorMismatch(host.get(), plugin.get());
        }
        return new CompatResult.Compatible(host.get(), plugin.get());
    }
}
