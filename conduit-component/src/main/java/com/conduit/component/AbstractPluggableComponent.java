package com.conduit.component;

import com.conduit.annotations.ConduitComponent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Base class taking id, name, version and dependencies from the {@link ConduitComponent} annotation on the
 * concrete class, and keeping the attach context for subclasses.
 */
public abstract class AbstractPluggableComponent implements PluggableComponent {

    private final ConduitComponent metadata;
    private volatile ComponentContext context;

    protected AbstractPluggableComponent() {
        this.metadata = getClass().getAnnotation(ConduitComponent.class);
        if (metadata == null) {
            throw new IllegalStateException(getClass().getName() + " is not annotated with @ConduitComponent");
        }
    }

    @Override
    public String getId() {
        return metadata.id();
    }

    @Override
    public String getName() {
        return metadata.name().isEmpty() ? metadata.id() : metadata.name();
    }

    @Override
    public String getVersion() {
        return metadata.version();
    }

    @Override
    public Set<String> getDependencies() {
        return Set.copyOf(new LinkedHashSet<>(List.of(metadata.dependsOn())));
    }

    @Override
    public final void onAttach(ComponentContext context) throws Exception {
        this.context = context;
        attach(context);
    }

    @Override
    public final void onDetach() throws Exception {
        try {
            detach();
        } finally {
            this.context = null;
        }
    }

    /** Context passed to the current attach; null while detached. */
    protected ComponentContext getContext() {
        return context;
    }

    protected void attach(ComponentContext context) throws Exception {
    }

    protected void detach() throws Exception {
    }
}
