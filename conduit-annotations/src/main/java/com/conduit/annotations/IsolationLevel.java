package com.conduit.annotations;

/**
 * Isolation level of a component's load boundary.
 */
public enum IsolationLevel {
    /** No restriction: everything outside shared core resolves from the host. */
    NONE,
    /** Parent-last: a module the component ships privately wins over the host's copy. Allowed/blocked modules apply. */
    STANDARD,
    /** Host-first: the component's private copies never shadow host modules. Allowed/blocked modules apply. */
    STRICT
}
