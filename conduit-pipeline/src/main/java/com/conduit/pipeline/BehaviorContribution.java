package com.conduit.pipeline;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A behavior contributed by a component to the request pipeline, with the metadata the chain engine
 * needs to place and gate it: priority (lower runs earlier), a constraint predicate evaluated right
 * before the behavior would run, free-form tags, an enabled flag, and an optional error handler.
 * Instances are immutable; use {@link #withEnabled(boolean)} to flip the flag.
 */
public final class BehaviorContribution {

    /** Default priority when none is given. */
    public static final int DEFAULT_PRIORITY = 1000;

    /** Chain order: ascending priority, ties broken by id. */
    public static final Comparator<BehaviorContribution> CHAIN_ORDER =
            Comparator.comparingInt(BehaviorContribution::getPriority)
                    .thenComparing(BehaviorContribution::getId);

    private static final Predicate<PipelineContext> ALWAYS = ctx -> true;

    private final String id;
    private final String name;
    private final String description;
    private final Behavior behavior;
    private final int priority;
    private final Predicate<PipelineContext> constraint;
    private final Set<String> tags;
    private final boolean enabled;
    private final ErrorHandler errorHandler;

    private BehaviorContribution(Builder b) {
        this.id = b.id;
        this.name = b.name != null && !b.name.isBlank() ? b.name : b.id;
        this.description = b.description;
        this.behavior = b.behavior;
        this.priority = b.priority;
        this.constraint = b.constraint != null ? b.constraint : ALWAYS;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(b.tags));
        this.enabled = b.enabled;
        this.errorHandler = b.errorHandler;
    }

    /** Minimal contribution: id and behavior, default priority, always applicable, enabled. */
    public static BehaviorContribution of(String id, Behavior behavior) {
        return builder().id(id).behavior(behavior).build();
    }

    public static BehaviorContribution of(String id, int priority, Behavior behavior) {
        return builder().id(id).priority(priority).behavior(behavior).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Optional description; may be null. */
    public String getDescription() {
        return description;
    }

    public Behavior getBehavior() {
        return behavior;
    }

    public int getPriority() {
        return priority;
    }

    public Predicate<PipelineContext> getConstraint() {
        return constraint;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Error handler wrapping this behavior, or null when failures propagate. */
    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    /** True if the constraint admits the behavior for this request. */
    public boolean appliesTo(PipelineContext context) {
        return constraint.test(context);
    }

    /** Returns a copy with the enabled flag set; {@code this} if unchanged. */
    public BehaviorContribution withEnabled(boolean enabled) {
        if (this.enabled == enabled) return this;
        return toBuilder().enabled(enabled).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .name(name)
                .description(description)
                .behavior(behavior)
                .priority(priority)
                .constraint(constraint)
                .tags(tags)
                .enabled(enabled)
                .errorHandler(errorHandler);
    }

    @Override
    public String toString() {
        return "BehaviorContribution{id=" + id + ", priority=" + priority + ", enabled=" + enabled + "}";
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private Behavior behavior;
        private int priority = DEFAULT_PRIORITY;
        private Predicate<PipelineContext> constraint;
        private final Set<String> tags = new LinkedHashSet<>();
        private boolean enabled = true;
        private ErrorHandler errorHandler;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder behavior(Behavior behavior) {
            this.behavior = behavior;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /** Condition evaluated against the context immediately before the behavior would run. */
        public Builder constraint(Predicate<PipelineContext> constraint) {
            this.constraint = constraint;
            return this;
        }

        public Builder tag(String tag) {
            if (tag != null && !tag.isBlank()) tags.add(tag.trim());
            return this;
        }

        public Builder tags(Set<String> tags) {
            if (tags != null) tags.forEach(this::tag);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder errorHandler(ErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        /**
         * @throws IllegalArgumentException if id is blank
         * @throws NullPointerException     if behavior is null
         */
        public BehaviorContribution build() {
            Objects.requireNonNull(id, "id");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Behavior contribution id must be non-blank");
            }
            id = id.trim();
            Objects.requireNonNull(behavior, "behavior");
            return new BehaviorContribution(this);
        }
    }
}
