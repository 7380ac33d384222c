package com.conduit.component.dependency;

/**
 * A component declares a dependency on an id that is not part of the resolved set.
 */
public final class UnknownDependencyException extends DependencyResolutionException {

    private final String componentId;
    private final String dependencyId;

    public UnknownDependencyException(String componentId, String dependencyId) {
        super("Component " + componentId + " depends on unknown component " + dependencyId);
        this.componentId = componentId;
        this.dependencyId = dependencyId;
    }

    public String getComponentId() {
        return componentId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
