package com.conduit.component;

import com.conduit.pipeline.BehaviorContribution;

import java.util.List;
import java.util.Set;

/**
 * Contract every component implements. The lifecycle manager calls {@link #onAttach(ComponentContext)} while
 * the component is initializing, collects {@link #contributeBehaviors()} once it is running, and calls
 * {@link #onDetach()} while it is stopping.
 * <p>
 * Implementations are loaded either from a component JAR/directory (through an isolated class loader) or
 * registered as compiled-in factories. Components that hold resources can also implement
 * {@link com.conduit.annotations.ResourceCleanup}.
 */
public interface PluggableComponent {

    /** Unique component id; must match the descriptor it was loaded for. */
    String getId();

    String getName();

    String getVersion();

    /** Ids of components that must be running before this one. */
    default Set<String> getDependencies() {
        return Set.of();
    }

    /**
     * Called once per lifecycle attempt while the component is initializing. Throwing fails the component.
     */
    void onAttach(ComponentContext context) throws Exception;

    /**
     * Behaviors this component adds to the request chain while it is running. Called after a successful
     * start; the result is spliced into the active chain as one unit.
     */
    default List<BehaviorContribution> contributeBehaviors() {
        return List.of();
    }

    /**
     * Called while the component is stopping. Throwing marks the component failed but does not stop
     * other components from stopping.
     */
    void onDetach() throws Exception;
}
