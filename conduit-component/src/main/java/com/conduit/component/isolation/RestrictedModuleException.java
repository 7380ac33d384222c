package com.conduit.component.isolation;

/**
 * A component referenced a module its isolation boundary rejects.
 */
public final class RestrictedModuleException extends RuntimeException {

    private final String componentId;
    private final String moduleName;

    public RestrictedModuleException(String componentId, String moduleName) {
        super("Module " + moduleName + " is restricted for component " + componentId);
        this.componentId = componentId;
        this.moduleName = moduleName;
    }

    public String getComponentId() {
        return componentId;
    }

    public String getModuleName() {
        return moduleName;
    }
}
