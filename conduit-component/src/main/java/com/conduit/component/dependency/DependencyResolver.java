package com.conduit.component.dependency;

import com.conduit.component.ComponentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the start order of a component set with Kahn's algorithm over the depends-on graph. Among
 * components whose dependencies are all placed, the smallest id goes first, so the same input always yields
 * the same order. Resolution either succeeds for the whole set or fails; it never returns a partial order.
 */
public final class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private DependencyResolver() {
    }

    /**
     * @throws UnknownDependencyException if a descriptor depends on an id outside the set
     * @throws CyclicDependencyException  if the graph has a cycle
     */
    public static Resolution resolve(Collection<ComponentDescriptor> descriptors) {
        return resolve(DependencyGraph.of(descriptors));
    }

    /**
     * @throws UnknownDependencyException if a node depends on an id outside the graph
     * @throws CyclicDependencyException  if the graph has a cycle
     */
    public static Resolution resolve(DependencyGraph graph) {
        Map<String, Set<String>> unknown = graph.getUnknownDependencies();
        if (!unknown.isEmpty()) {
            Map.Entry<String, Set<String>> first = unknown.entrySet().iterator().next();
            throw new UnknownDependencyException(first.getKey(), first.getValue().iterator().next());
        }

        Map<String, Integer> pending = new HashMap<>();
        TreeSet<String> ready = new TreeSet<>();
        for (String id : graph.nodes()) {
            int n = graph.getDependencies(id).size();
            pending.put(id, n);
            if (n == 0) ready.add(id);
        }

        List<String> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            String id = ready.pollFirst();
            order.add(id);
            for (String dependent : graph.getDependents(id)) {
                int left = pending.merge(dependent, -1, Integer::sum);
                if (left == 0) ready.add(dependent);
            }
        }

        if (order.size() < graph.size()) {
            Set<String> stalled = new TreeSet<>(graph.nodes());
            stalled.removeAll(order);
            List<String> cycle = graph.walkToCycle(stalled.iterator().next(), stalled);
            log.warn("Dependency resolution failed: cycle {} ({} component(s) unresolved)", cycle, stalled.size());
            throw new CyclicDependencyException(cycle);
        }
        log.debug("Resolved start order: {}", order);
        return new Resolution(order);
    }

    /**
     * Successful resolution: start order and its reverse.
     */
    public static final class Resolution {
        private final List<String> startOrder;
        private final List<String> stopOrder;

        Resolution(List<String> startOrder) {
            this.startOrder = List.copyOf(startOrder);
            List<String> reversed = new ArrayList<>(startOrder);
            Collections.reverse(reversed);
            this.stopOrder = List.copyOf(reversed);
        }

        /** Every component appears after all of its dependencies. */
        public List<String> getStartOrder() {
            return startOrder;
        }

        public List<String> getStopOrder() {
            return stopOrder;
        }
    }
}
