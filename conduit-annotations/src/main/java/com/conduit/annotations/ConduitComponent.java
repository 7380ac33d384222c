package com.conduit.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a pluggable component and declares its descriptor metadata. The runtime reads it when
 * a component is registered from its class (compiled-in components) and when discovery finds an entry
 * point without a manifest.
 * <p>
 * Ids are lowercase, dot-separated segments (e.g. {@code acme.audit-log}); versions are semantic
 * ({@code 1.2.0} or {@code 1.2.0-beta}).
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ConduitComponent {

    /** Unique component id. */
    String id();

    /** Display name. Empty = id. */
    String name() default "";

    /** Semantic version. */
    String version() default "1.0.0";

    /** Optional description. */
    String description() default "";

    /** Ids of components that must be running before this one starts. */
    String[] dependsOn() default { };

    /** How the component's private modules are separated from other components. */
    IsolationLevel isolation() default IsolationLevel.STANDARD;

    /** Module name prefixes the component may load even if not shared core. Empty = no restriction. */
    String[] allowedModules() default { };

    /** Module name prefixes the component must never load. Takes precedence over {@link #allowedModules()}. */
    String[] blockedModules() default { };

    /** Modules that must be loadable before the component is attached. */
    String[] requiredModules() default { };
}
