package com.acme.finops.pluginhost.model;

import java.util.List;

public record DryRunResult(List<FieldMapping> fieldMappings, boolean configValid, List<String> configErrors) {
    public DryRunResult {
        fieldMappings = List.copyOf(fieldMappings == null ? List.of() : fieldMappings);
        configErrors = List.copyOf(configErrors == null ? List.of() : configErrors);
    }
}
