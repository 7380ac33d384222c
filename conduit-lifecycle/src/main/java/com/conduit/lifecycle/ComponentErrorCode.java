package com.conduit.lifecycle;

/**
 * What went wrong for a component, with the severity normally reported for it.
 */
public enum ComponentErrorCode {
    /** Descriptor failed validation (id, name, version or self-dependency). */
    INVALID_DESCRIPTOR(ErrorSeverity.ERROR),
    UNKNOWN_DEPENDENCY(ErrorSeverity.CRITICAL),
    CYCLIC_DEPENDENCY(ErrorSeverity.CRITICAL),
    /** Component was not started because resolution of its batch failed elsewhere. */
    RESOLUTION_ABORTED(ErrorSeverity.WARNING),
    /** A dependency is not running, so the component was never attempted. */
    DEPENDENCY_FAILED(ErrorSeverity.ERROR),
    RESTRICTED_MODULE(ErrorSeverity.CRITICAL),
    NO_LOADER(ErrorSeverity.CRITICAL),
    LOAD_FAILED(ErrorSeverity.ERROR),
    ATTACH_FAILED(ErrorSeverity.ERROR),
    CONTRIBUTION_FAILED(ErrorSeverity.ERROR),
    DUPLICATE_REGISTRATION(ErrorSeverity.ERROR),
    DETACH_FAILED(ErrorSeverity.WARNING),
    CLEANUP_FAILED(ErrorSeverity.WARNING),
    /** Operation needs a running component. */
    NOT_RUNNING(ErrorSeverity.WARNING);

    private final ErrorSeverity defaultSeverity;

    ComponentErrorCode(ErrorSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public ErrorSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}
