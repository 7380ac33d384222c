package com.conduit.component.isolation;

import com.conduit.component.ComponentDescriptor;
import com.conduit.component.PluggableComponent;

/**
 * Produces a component instance for a descriptor inside a load boundary.
 */
public interface ComponentLoader {

    /** Whether this loader knows how to load {@code descriptor}. */
    boolean supports(ComponentDescriptor descriptor);

    /**
     * Loads the component's entry point and returns a new instance. Unloading is closing the boundary.
     *
     * @throws ComponentLoadException    if the code cannot be loaded or instantiated
     * @throws RestrictedModuleException if the boundary rejects the entry point
     */
    PluggableComponent load(ComponentDescriptor descriptor, LoadBoundary boundary);
}
