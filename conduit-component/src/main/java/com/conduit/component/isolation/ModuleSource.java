package com.conduit.component.isolation;

/**
 * Where a module referenced by a component is resolved from.
 */
public enum ModuleSource {
    /** From the trusted host. */
    SHARED_CORE,
    /** From the component's own private location. */
    PRIVATE,
    /** Not loadable by this component. */
    REJECTED
}
