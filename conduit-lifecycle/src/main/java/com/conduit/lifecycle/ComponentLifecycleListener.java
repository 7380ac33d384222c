package com.conduit.lifecycle;

import com.conduit.component.ComponentDescriptor;
import com.conduit.component.ComponentState;

/**
 * Receives lifecycle events. Called on the thread that performed the transition; exceptions are logged
 * and ignored.
 */
public interface ComponentLifecycleListener {

    /** A component moved from {@code from} to {@code to}. */
    default void onTransition(ComponentDescriptor descriptor, ComponentState from, ComponentState to) {
    }

    default void onError(ComponentError error) {
    }
}
