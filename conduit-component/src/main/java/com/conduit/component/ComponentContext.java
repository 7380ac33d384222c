package com.conduit.component;

import java.util.Map;
import java.util.Objects;

/**
 * What a component receives on attach: its own descriptor, a read-only view of the other registered
 * components, and string properties from the runtime configuration.
 */
public final class ComponentContext {

    private final ComponentDescriptor descriptor;
    private final ComponentLookup components;
    private final Map<String, String> properties;

    public ComponentContext(ComponentDescriptor descriptor, ComponentLookup components, Map<String, String> properties) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.components = Objects.requireNonNull(components, "components");
        this.properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public String getComponentId() {
        return descriptor.getId();
    }

    public ComponentDescriptor getDescriptor() {
        return descriptor;
    }

    /** Running components, for looking up dependencies. */
    public ComponentLookup getComponents() {
        return components;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public String getProperty(String key, String defaultValue) {
        String v = properties.get(key);
        return v != null ? v : defaultValue;
    }
}
