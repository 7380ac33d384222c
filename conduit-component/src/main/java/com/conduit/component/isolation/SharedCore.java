package com.conduit.component.isolation;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide set of modules always resolved from the host: the JDK, the logging API, and the runtime's
 * own component and pipeline APIs (a component sees the host's {@code PluggableComponent}, never a private copy).
 * Fixed at bootstrap; extra entries come from configuration.
 */
public final class SharedCore {

    public static final Set<String> DEFAULT_MODULES = Set.of(
            "java",
            "javax",
            "jdk",
            "sun",
            "com.sun",
            "org.slf4j",
            "com.conduit.annotations",
            "com.conduit.pipeline",
            "com.conduit.component");

    private static final SharedCore DEFAULTS = new SharedCore(DEFAULT_MODULES);

    private final Set<String> modules;

    private SharedCore(Collection<String> modules) {
        Set<String> all = new TreeSet<>();
        for (String m : modules) {
            if (m != null && !m.isBlank()) all.add(m.trim());
        }
        this.modules = Collections.unmodifiableSet(all);
    }

    public static SharedCore defaults() {
        return DEFAULTS;
    }

    /** Default modules plus {@code extraModules}. */
    public static SharedCore withExtras(Collection<String> extraModules) {
        if (extraModules == null || extraModules.isEmpty()) return DEFAULTS;
        Set<String> all = new TreeSet<>(DEFAULT_MODULES);
        all.addAll(extraModules);
        return new SharedCore(all);
    }

    public boolean contains(String moduleName) {
        return ModuleNames.coveredByAny(modules, moduleName);
    }

    public Set<String> getModules() {
        return modules;
    }

    @Override
    public String toString() {
        return "SharedCore" + modules;
    }
}
