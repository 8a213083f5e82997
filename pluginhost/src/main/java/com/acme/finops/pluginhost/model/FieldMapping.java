package com.acme.finops.pluginhost.model;

import java.util.Objects;

/**
 * How a plugin treats one cost field for a resource type.
 *
 * @param condition    set only for {@link FieldMappingStatus#CONDITIONAL}
 * @param expectedType value type the field carries, e.g. {@code double}
 */
public record FieldMapping(String fieldName, FieldMappingStatus status, String condition, String expectedType) {
    public FieldMapping {
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(status, "status");
        condition = condition == null ? "" : condition;
        expectedType = expectedType == null ? "" : expectedType;
    }
}
