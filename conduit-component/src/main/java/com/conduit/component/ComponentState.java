package com.conduit.component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of a component.
 * <pre>
 * REGISTERED → RESOLVED → INITIALIZING → INITIALIZED → STARTING → RUNNING → STOPPING → STOPPED → UNLOADED
 * </pre>
 * FAILED is reachable from every non-terminal state. STOPPED, FAILED and UNLOADED may re-enter RESOLVED
 * for a restart or reload.
 */
public enum ComponentState {
    REGISTERED,
    RESOLVED,
    INITIALIZING,
    INITIALIZED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED,
    UNLOADED;

    private static final Map<ComponentState, Set<ComponentState>> TRANSITIONS = Map.of(
            REGISTERED, EnumSet.of(RESOLVED, FAILED),
            RESOLVED, EnumSet.of(INITIALIZING, FAILED),
            INITIALIZING, EnumSet.of(INITIALIZED, FAILED),
            INITIALIZED, EnumSet.of(STARTING, FAILED),
            STARTING, EnumSet.of(RUNNING, FAILED),
            RUNNING, EnumSet.of(STOPPING, FAILED),
            STOPPING, EnumSet.of(STOPPED, FAILED),
            STOPPED, EnumSet.of(UNLOADED, RESOLVED, FAILED),
            FAILED, EnumSet.of(RESOLVED),
            UNLOADED, EnumSet.of(RESOLVED));

    public boolean canTransitionTo(ComponentState target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    /** Running and serving requests. */
    public boolean isActive() {
        return this == RUNNING;
    }

    /** End of a lifecycle attempt. */
    public boolean isTerminal() {
        return this == FAILED || this == UNLOADED;
    }

    /** Between resolution and running: a start is in progress. */
    public boolean isStarting() {
        return this == RESOLVED || this == INITIALIZING || this == INITIALIZED || this == STARTING;
    }
}
