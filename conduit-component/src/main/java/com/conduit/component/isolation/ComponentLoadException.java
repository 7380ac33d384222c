package com.conduit.component.isolation;

/**
 * Loading a component's code or metadata failed.
 */
public final class ComponentLoadException extends RuntimeException {

    private final String componentId;

    public ComponentLoadException(String componentId, String message) {
        super(message);
        this.componentId = componentId;
    }

    public ComponentLoadException(String componentId, String message, Throwable cause) {
        super(message, cause);
        this.componentId = componentId;
    }

    /** Id of the component, or null if not known yet (e.g. unreadable manifest). */
    public String getComponentId() {
        return componentId;
    }
}
