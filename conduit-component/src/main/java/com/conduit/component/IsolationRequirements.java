package com.conduit.component;

import com.conduit.annotations.IsolationLevel;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Isolation level plus allowed and blocked module names of a component. Module names are package or
 * class name prefixes matched on segment boundaries ({@code com.acme} covers {@code com.acme.Foo} and
 * {@code com.acme.util}, not {@code com.acmecorp}). An empty allow-list means no allow-list restriction.
 */
public final class IsolationRequirements {

    private static final IsolationRequirements STANDARD = new IsolationRequirements(IsolationLevel.STANDARD, Set.of(), Set.of());
    private static final IsolationRequirements NONE = new IsolationRequirements(IsolationLevel.NONE, Set.of(), Set.of());

    private final IsolationLevel level;
    private final Set<String> allowedModules;
    private final Set<String> blockedModules;

    private IsolationRequirements(IsolationLevel level, Collection<String> allowed, Collection<String> blocked) {
        this.level = Objects.requireNonNull(level, "level");
        this.allowedModules = normalize(allowed);
        this.blockedModules = normalize(blocked);
    }

    public static IsolationRequirements standard() {
        return STANDARD;
    }

    public static IsolationRequirements none() {
        return NONE;
    }

    public static IsolationRequirements of(IsolationLevel level, Collection<String> allowedModules,
                                           Collection<String> blockedModules) {
        return new IsolationRequirements(level, allowedModules, blockedModules);
    }

    public IsolationLevel getLevel() {
        return level;
    }

    public Set<String> getAllowedModules() {
        return allowedModules;
    }

    public Set<String> getBlockedModules() {
        return blockedModules;
    }

    private static Set<String> normalize(Collection<String> names) {
        if (names == null || names.isEmpty()) return Set.of();
        Set<String> out = new TreeSet<>();
        for (String n : names) {
            if (n != null && !n.isBlank()) out.add(n.trim());
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IsolationRequirements)) return false;
        IsolationRequirements that = (IsolationRequirements) o;
        return level == that.level && allowedModules.equals(that.allowedModules) && blockedModules.equals(that.blockedModules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, allowedModules, blockedModules);
    }

    @Override
    public String toString() {
        return "IsolationRequirements{" + level + ", allowed=" + allowedModules + ", blocked=" + blockedModules + "}";
    }
}
