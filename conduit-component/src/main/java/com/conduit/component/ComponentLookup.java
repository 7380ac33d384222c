package com.conduit.component;

import java.util.Set;

/**
 * Read-only view of registered components.
 */
public interface ComponentLookup {

    /** Instance registered under {@code id}, or null. */
    PluggableComponent get(String id);

    /** Instance registered under {@code id} if it is a {@code type}, otherwise null. */
    default <T> T get(String id, Class<T> type) {
        PluggableComponent c = get(id);
        return type.isInstance(c) ? type.cast(c) : null;
    }

    /** Descriptor registered under {@code id}, or null. */
    ComponentDescriptor getDescriptor(String id);

    boolean isRegistered(String id);

    /** Snapshot of all registered descriptors, ordered by id. */
    Set<ComponentDescriptor> allDescriptors();
}
