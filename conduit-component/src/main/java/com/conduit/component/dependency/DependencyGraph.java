package com.conduit.component.dependency;

import com.conduit.component.ComponentDescriptor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed "depends on" graph over component ids (edge {@code a → b} when {@code a} depends on {@code b}).
 * Built fresh from a descriptor set for each resolution. Edges to ids outside the node set are kept so they
 * can be reported; all other queries only follow edges between known nodes. Iteration orders are sorted by id.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    private DependencyGraph(Map<String, Set<String>> dependencies) {
        this.dependencies = dependencies;
        Map<String, Set<String>> rev = new TreeMap<>();
        dependencies.keySet().forEach(id -> rev.put(id, new TreeSet<>()));
        dependencies.forEach((id, deps) -> deps.forEach(dep -> {
            Set<String> d = rev.get(dep);
            if (d != null) d.add(id);
        }));
        rev.replaceAll((id, set) -> Collections.unmodifiableSet(set));
        this.dependents = Collections.unmodifiableMap(rev);
    }

    /**
     * @throws IllegalArgumentException if two descriptors share an id
     */
    public static DependencyGraph of(Collection<ComponentDescriptor> descriptors) {
        Map<String, Collection<String>> edges = new LinkedHashMap<>();
        for (ComponentDescriptor d : descriptors) {
            if (edges.put(d.getId(), d.getDependencies()) != null) {
                throw new IllegalArgumentException("Duplicate component id: " + d.getId());
            }
        }
        return fromEdges(edges);
    }

    /** Graph from {@code id → dependency ids}. */
    public static DependencyGraph fromEdges(Map<String, ? extends Collection<String>> edges) {
        Map<String, Set<String>> deps = new TreeMap<>();
        edges.forEach((id, ds) -> deps.put(Objects.requireNonNull(id, "id"),
                Collections.unmodifiableSet(ds != null ? new TreeSet<>(ds) : new TreeSet<>())));
        return new DependencyGraph(Collections.unmodifiableMap(deps));
    }

    public Set<String> nodes() {
        return dependencies.keySet();
    }

    public boolean contains(String id) {
        return dependencies.containsKey(id);
    }

    public int size() {
        return dependencies.size();
    }

    /** Declared dependencies of {@code id}, including unknown ones; empty for an unknown node. */
    public Set<String> getDependencies(String id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    /** Nodes that directly depend on {@code id}. */
    public Set<String> getDependents(String id) {
        return dependents.getOrDefault(id, Set.of());
    }

    /** Everything {@code id} needs, directly or indirectly (known nodes only). */
    public Set<String> getTransitiveDependencies(String id) {
        return reach(id, dependencies);
    }

    /** Everything that needs {@code id}, directly or indirectly. */
    public Set<String> getTransitiveDependents(String id) {
        return reach(id, dependents);
    }

    /** Nodes with no dependencies. */
    public Set<String> getRootComponents() {
        Set<String> out = new TreeSet<>();
        dependencies.forEach((id, deps) -> {
            if (deps.isEmpty()) out.add(id);
        });
        return out;
    }

    /** Nodes nothing depends on. */
    public Set<String> getLeafComponents() {
        Set<String> out = new TreeSet<>();
        dependents.forEach((id, ds) -> {
            if (ds.isEmpty()) out.add(id);
        });
        return out;
    }

    /** {@code id → dependency ids not in the graph}, for nodes that have any. */
    public Map<String, Set<String>> getUnknownDependencies() {
        Map<String, Set<String>> out = new TreeMap<>();
        dependencies.forEach((id, deps) -> {
            for (String dep : deps) {
                if (!dependencies.containsKey(dep)) {
                    out.computeIfAbsent(id, k -> new TreeSet<>()).add(dep);
                }
            }
        });
        return out;
    }

    /** Nodes that are part of at least one cycle. */
    public Set<String> getCycleMembers() {
        Set<String> out = new TreeSet<>();
        for (String id : dependencies.keySet()) {
            if (getTransitiveDependencies(id).contains(id)) out.add(id);
        }
        return out;
    }

    /**
     * One concrete cycle, or an empty list if the graph is acyclic.
     */
    public List<String> findCycle() {
        Set<String> members = getCycleMembers();
        return members.isEmpty() ? List.of() : walkToCycle(members.iterator().next(), members);
    }

    /**
     * Follows depends-on edges from {@code start}, staying inside {@code within}, until an id repeats; returns
     * the repeating segment. Every node of {@code within} must have a dependency inside {@code within}.
     */
    List<String> walkToCycle(String start, Set<String> within) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> seenAt = new LinkedHashMap<>();
        String current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, path.size());
            path.add(current);
            String next = null;
            for (String dep : getDependencies(current)) {
                if (within.contains(dep)) {
                    next = dep;
                    break;
                }
            }
            if (next == null) {
                throw new IllegalStateException("No cycle reachable from " + start);
            }
            current = next;
        }
        return List.copyOf(path.subList(seenAt.get(current), path.size()));
    }

    /** Graph restricted to {@code ids}; edges leaving the subset are dropped. */
    public DependencyGraph subgraph(Collection<String> ids) {
        Set<String> keep = new TreeSet<>(ids);
        Map<String, Set<String>> edges = new TreeMap<>();
        for (String id : keep) {
            if (!dependencies.containsKey(id)) continue;
            Set<String> deps = new TreeSet<>(dependencies.get(id));
            deps.retainAll(keep);
            edges.put(id, deps);
        }
        return fromEdges(edges);
    }

    private Set<String> reach(String id, Map<String, Set<String>> adjacency) {
        Set<String> seen = new TreeSet<>();
        Deque<String> todo = new ArrayDeque<>(adjacency.getOrDefault(id, Set.of()));
        while (!todo.isEmpty()) {
            String n = todo.pop();
            if (!dependencies.containsKey(n) || !seen.add(n)) continue;
            todo.addAll(adjacency.getOrDefault(n, Set.of()));
        }
        return seen;
    }

    @Override
    public String toString() {
        return "DependencyGraph" + dependencies;
    }
}
