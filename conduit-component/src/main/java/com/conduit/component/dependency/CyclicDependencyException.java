package com.conduit.component.dependency;

import java.util.List;

/**
 * The dependency graph contains a cycle. {@link #getCycleMembers()} lists one concrete cycle in
 * depends-on order, each member once.
 */
public final class CyclicDependencyException extends DependencyResolutionException {

    private final List<String> cycleMembers;

    public CyclicDependencyException(List<String> cycleMembers) {
        super("Cyclic dependency: " + describe(cycleMembers));
        this.cycleMembers = List.copyOf(cycleMembers);
    }

    public List<String> getCycleMembers() {
        return cycleMembers;
    }

    private static String describe(List<String> cycle) {
        if (cycle.isEmpty()) return "[]";
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }
}
