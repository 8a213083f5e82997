package com.acme.finops.pluginhost.compat;

public sealed interface CompatResult permits CompatResult.Compatible, CompatResult.MajorMismatch, CompatResult.Invalid {
    record Compatible(SemanticVersion host, SemanticVersion plugin) implements CompatResult {}
    record MajorMismatch(SemanticVersion host, SemanticVersion plugin) implements CompatResult {}
    record Invalid(String rawPluginVersion, String reason) implements CompatResult {}
}
