package com.acme.finops.pluginhost.compat;

public interface CompatAnalyzer {
    CompatResult analyze(String hostSpecVersion, String pluginSpecVersion);
}
