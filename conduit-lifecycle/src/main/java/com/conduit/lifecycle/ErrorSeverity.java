package com.conduit.lifecycle;

/**
 * Severity of a {@link ComponentError}, lowest first.
 */
public enum ErrorSeverity {
    INFORMATION,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(ErrorSeverity other) {
        return compareTo(other) >= 0;
    }
}
