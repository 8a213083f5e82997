package com.acme.finops.pluginhost.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One resource to price. The core treats it as opaque; only plugins interpret the properties.
 *
 * @param id           caller-chosen identifier; defaults to the resource type
 * @param provider     cloud provider, may be blank when the type carries it as a prefix
 * @param resourceType provider-qualified type such as {@code aws:ec2/instance:Instance}
 * @param properties   schema-free attributes
 */
public record ResourceDescriptor(String id, String provider, String resourceType, PropertyBag properties) {

    public ResourceDescriptor {
        Objects.requireNonNull(resourceType, "resourceType");
        provider = provider == null ? "" : provider.trim();
        id = id == null || id.isBlank() ? resourceType : id;
        properties = properties == null ? PropertyBag.empty() : properties;
    }

    public ResourceDescriptor(String provider, String resourceType, PropertyBag properties) {
        this(null, provider, resourceType, properties);
    }

    /**
     * Declared provider, or the segment of the type before the first {@code ':'} when none is declared.
     */
    public String effectiveProvider() {
        if (!provider.isEmpty()) {
            return provider.toLowerCase(Locale.ROOT);
        }
        int colon = resourceType.indexOf(':');
        return colon > 0 ? resourceType.substring(0, colon).toLowerCase(Locale.ROOT) : "";
    }
}
