package com.conduit.component;

import com.conduit.annotations.ConduitComponent;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identity record of a component: id, name, version, declared dependency ids, isolation requirements,
 * required modules and where its code comes from (private location and entry point class, or none for
 * compiled-in components).
 * <p>
 * Everything except the lifecycle state is immutable. The state is changed only by the lifecycle manager
 * through {@link #transitionTo(ComponentState)}, which enforces {@link ComponentState#canTransitionTo}.
 * Descriptors are equal by id.
 */
public final class ComponentDescriptor {

    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final Set<String> dependencies;
    private final IsolationRequirements isolation;
    private final Set<String> requiredModules;
    private final String entryPoint;
    private final Path location;
    private volatile ComponentState state = ComponentState.REGISTERED;

    private ComponentDescriptor(Builder b) {
        this.id = b.id;
        this.name = b.name != null && !b.name.isBlank() ? b.name : b.id;
        this.version = b.version;
        this.description = b.description != null ? b.description : "";
        this.dependencies = Collections.unmodifiableSet(new TreeSet<>(b.dependencies));
        this.isolation = b.isolation;
        this.requiredModules = Collections.unmodifiableSet(new TreeSet<>(b.requiredModules));
        this.entryPoint = b.entryPoint;
        this.location = b.location;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Descriptor from the {@link ConduitComponent} annotation of a compiled-in component class.
     *
     * @throws IllegalArgumentException if the class is not annotated
     */
    public static ComponentDescriptor fromAnnotation(Class<?> type) {
        ConduitComponent ann = type.getAnnotation(ConduitComponent.class);
        if (ann == null) {
            throw new IllegalArgumentException(type.getName() + " is not annotated with @ConduitComponent");
        }
        return builder(ann.id())
                .name(ann.name())
                .version(ann.version())
                .description(ann.description())
                .dependencies(Arrays.asList(ann.dependsOn()))
                .isolation(IsolationRequirements.of(ann.isolation(),
                        Arrays.asList(ann.allowedModules()), Arrays.asList(ann.blockedModules())))
                .requiredModules(Arrays.asList(ann.requiredModules()))
                .entryPoint(type.getName())
                .build();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    /** Declared dependency ids, sorted. */
    public Set<String> getDependencies() {
        return dependencies;
    }

    public boolean dependsOn(String componentId) {
        return dependencies.contains(componentId);
    }

    public IsolationRequirements getIsolation() {
        return isolation;
    }

    /** Modules the component needs; each must pass the isolation boundary before the component is loaded. */
    public Set<String> getRequiredModules() {
        return requiredModules;
    }

    /** Fully qualified class name of the component implementation; may be null for factory-registered components. */
    public String getEntryPoint() {
        return entryPoint;
    }

    /** Private module location (JAR or directory); null for compiled-in components. */
    public Path getLocation() {
        return location;
    }

    public ComponentState getState() {
        return state;
    }

    /**
     * Moves to {@code next}.
     *
     * @return the previous state
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public synchronized ComponentState transitionTo(ComponentState next) {
        Objects.requireNonNull(next, "next");
        ComponentState current = state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Component " + id + ": invalid transition " + current + " -> " + next);
        }
        state = next;
        return current;
    }

    /**
     * Moves to {@link ComponentState#FAILED} unless already failed.
     *
     * @return the previous state
     */
    public synchronized ComponentState markFailed() {
        ComponentState current = state;
        if (current != ComponentState.FAILED) {
            state = ComponentState.FAILED;
        }
        return current;
    }

    /** Copy with the same identity and code location, in state {@link ComponentState#REGISTERED}. */
    public Builder toBuilder() {
        return builder(id)
                .name(name)
                .version(version)
                .description(description)
                .dependencies(dependencies)
                .isolation(isolation)
                .requiredModules(requiredModules)
                .entryPoint(entryPoint)
                .location(location);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComponentDescriptor)) return false;
        return id.equals(((ComponentDescriptor) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ComponentDescriptor{" + id + "@" + version + ", state=" + state + ", deps=" + dependencies + "}";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String version = "1.0.0";
        private String description;
        private final Set<String> dependencies = new TreeSet<>();
        private IsolationRequirements isolation = IsolationRequirements.standard();
        private final Set<String> requiredModules = new TreeSet<>();
        private String entryPoint;
        private Path location;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id").trim();
            if (this.id.isEmpty()) {
                throw new IllegalArgumentException("Component id must be non-blank");
            }
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = Objects.requireNonNull(version, "version");
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dependsOn(String... ids) {
            return dependencies(Arrays.asList(ids));
        }

        public Builder dependencies(Collection<String> ids) {
            if (ids != null) {
                for (String d : ids) {
                    if (d != null && !d.isBlank()) dependencies.add(d.trim());
                }
            }
            return this;
        }

        public Builder isolation(IsolationRequirements isolation) {
            this.isolation = Objects.requireNonNull(isolation, "isolation");
            return this;
        }

        public Builder requiredModules(Collection<String> modules) {
            if (modules != null) {
                for (String m : modules) {
                    if (m != null && !m.isBlank()) requiredModules.add(m.trim());
                }
            }
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder location(Path location) {
            this.location = location;
            return this;
        }

        public ComponentDescriptor build() {
            return new ComponentDescriptor(this);
        }
    }
}
