package com.conduit.component.isolation;

import com.conduit.component.ComponentDescriptor;
import com.conduit.component.PluggableComponent;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Loader for compiled-in components: a factory per component id. Every load creates a fresh instance,
 * so a hot reload replaces the instance but not the code (that needs a process restart).
 */
public final class RegisteredComponentLoader implements ComponentLoader {

    private final Map<String, Supplier<? extends PluggableComponent>> factories = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if a factory is already registered for {@code id}
     */
    public void register(String id, Supplier<? extends PluggableComponent> factory) {
        Objects.requireNonNull(factory, "factory");
        String cid = Objects.requireNonNull(id, "id").trim();
        if (cid.isEmpty()) {
            throw new IllegalArgumentException("Component id must be non-blank");
        }
        if (factories.putIfAbsent(cid, factory) != null) {
            throw new IllegalArgumentException("Factory already registered for component " + cid);
        }
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    @Override
    public boolean supports(ComponentDescriptor descriptor) {
        return factories.containsKey(descriptor.getId());
    }

    @Override
    public PluggableComponent load(ComponentDescriptor descriptor, LoadBoundary boundary) {
        String id = descriptor.getId();
        Supplier<? extends PluggableComponent> factory = factories.get(id);
        if (factory == null) {
            throw new ComponentLoadException(id, "No factory registered for component " + id);
        }
        if (descriptor.getEntryPoint() != null) {
            boundary.check(descriptor.getEntryPoint());
        }
        PluggableComponent instance;
        try {
            instance = factory.get();
        } catch (RuntimeException e) {
            throw new ComponentLoadException(id, "Factory of component " + id + " failed: " + e.getMessage(), e);
        }
        if (instance == null || !id.equals(instance.getId())) {
            throw new ComponentLoadException(id, "Factory of component " + id + " returned "
                    + (instance == null ? "null" : "component " + instance.getId()));
        }
        return instance;
    }
}
