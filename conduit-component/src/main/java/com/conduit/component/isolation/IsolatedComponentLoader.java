package com.conduit.component.isolation;

import com.conduit.component.ComponentDescriptor;
import com.conduit.component.PluggableComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Loads a component from its private location (JAR or exploded directory) with a per-boundary
 * {@link ComponentClassLoader}, and instantiates the descriptor's entry point through its no-arg constructor.
 */
public final class IsolatedComponentLoader implements ComponentLoader {

    private static final Logger log = LoggerFactory.getLogger(IsolatedComponentLoader.class);

    private final ClassLoader hostLoader;

    public IsolatedComponentLoader() {
        this(PluggableComponent.class.getClassLoader());
    }

    /**
     * @param hostLoader loader providing the shared core and host fallback
     */
    public IsolatedComponentLoader(ClassLoader hostLoader) {
        this.hostLoader = Objects.requireNonNull(hostLoader, "hostLoader");
    }

    @Override
    public boolean supports(ComponentDescriptor descriptor) {
        return descriptor.getLocation() != null && descriptor.getEntryPoint() != null;
    }

    @Override
    public PluggableComponent load(ComponentDescriptor descriptor, LoadBoundary boundary) {
        String id = descriptor.getId();
        String entryPoint = descriptor.getEntryPoint();
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new ComponentLoadException(id, "Component " + id + " has no entry point");
        }
        boundary.check(entryPoint);
        ComponentClassLoader loader = boundary.openClassLoader(hostLoader);
        PluggableComponent instance;
        try {
            Class<?> type = Class.forName(entryPoint, true, loader);
            if (!PluggableComponent.class.isAssignableFrom(type)) {
                throw new ComponentLoadException(id, "Entry point " + entryPoint + " does not implement "
                        + PluggableComponent.class.getName());
            }
            instance = type.asSubclass(PluggableComponent.class).getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new ComponentLoadException(id, "Failed to load entry point " + entryPoint + " of component "
                    + id + ": " + e, e);
        }
        if (!id.equals(instance.getId())) {
            throw new ComponentLoadException(id, "Entry point " + entryPoint + " reports id " + instance.getId()
                    + ", expected " + id);
        }
        log.info("Loaded component {} ({}) from {}", id, entryPoint, descriptor.getLocation());
        return instance;
    }
}
