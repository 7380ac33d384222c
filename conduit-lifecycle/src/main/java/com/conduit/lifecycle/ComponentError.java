package com.conduit.lifecycle;

import java.time.Instant;
import java.util.Objects;

/**
 * One failure recorded by the lifecycle manager for a component.
 */
public final class ComponentError {

    private final String componentId;
    private final ComponentErrorCode code;
    private final String message;
    private final ErrorSeverity severity;
    private final Throwable cause;
    private final Instant timestamp;

    public ComponentError(String componentId, ComponentErrorCode code, String message,
                          ErrorSeverity severity, Throwable cause) {
        this.componentId = Objects.requireNonNull(componentId, "componentId");
        this.code = Objects.requireNonNull(code, "code");
        this.message = message != null ? message : "";
        this.severity = Objects.requireNonNull(severity, "severity");
        this.cause = cause;
        this.timestamp = Instant.now();
    }

    /** Error with the code's default severity. */
    public static ComponentError of(String componentId, ComponentErrorCode code, String message, Throwable cause) {
        return new ComponentError(componentId, code, message, code.getDefaultSeverity(), cause);
    }

    public static ComponentError of(String componentId, ComponentErrorCode code, String message) {
        return of(componentId, code, message, null);
    }

    public String getComponentId() {
        return componentId;
    }

    public ComponentErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    /** Underlying exception; null if none. */
    public Throwable getCause() {
        return cause;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return severity + " " + code + " [" + componentId + "]: " + message;
    }
}
