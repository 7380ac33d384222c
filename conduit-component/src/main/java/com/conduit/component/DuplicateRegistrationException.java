package com.conduit.component;

/**
 * Thrown by {@link ComponentRegistry#registerOrThrow} when the id is already registered.
 */
public final class DuplicateRegistrationException extends RuntimeException {

    private final String componentId;

    public DuplicateRegistrationException(String componentId) {
        super("Component already registered: " + componentId);
        this.componentId = componentId;
    }

    public String getComponentId() {
        return componentId;
    }
}
