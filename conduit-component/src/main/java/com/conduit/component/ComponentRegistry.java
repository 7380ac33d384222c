package com.conduit.component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of running components by id: instance plus descriptor. Owned by the lifecycle manager, which
 * registers a component once it is running and unregisters it when it stops; other code gets the
 * {@link ComponentLookup} view.
 * <p>
 * Registration is register-if-absent: a second registration for the same id is rejected and leaves the
 * existing entry untouched. All operations are safe for concurrent callers.
 */
public final class ComponentRegistry implements ComponentLookup {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final ComponentLookup readOnly = new ReadOnlyLookup(this);

    /**
     * Registers a component under {@code id} if no entry exists for it.
     *
     * @return true if stored; false if {@code id} was already registered (registry unchanged)
     * @throws IllegalArgumentException if {@code id} is blank or does not match the descriptor id
     */
    public boolean register(String id, PluggableComponent instance, ComponentDescriptor descriptor) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(descriptor, "descriptor");
        String cid = Objects.requireNonNull(id, "id").trim();
        if (cid.isEmpty()) {
            throw new IllegalArgumentException("Component id must be non-blank");
        }
        if (!cid.equals(descriptor.getId())) {
            throw new IllegalArgumentException("Id " + cid + " does not match descriptor id " + descriptor.getId());
        }
        return entries.putIfAbsent(cid, new Entry(instance, descriptor)) == null;
    }

    /**
     * As {@link #register} but throws on a duplicate.
     *
     * @throws DuplicateRegistrationException if {@code id} is already registered
     */
    public void registerOrThrow(String id, PluggableComponent instance, ComponentDescriptor descriptor) {
        if (!register(id, instance, descriptor)) {
            throw new DuplicateRegistrationException(id);
        }
    }

    @Override
    public PluggableComponent get(String id) {
        Entry e = entry(id);
        return e != null ? e.getInstance() : null;
    }

    @Override
    public ComponentDescriptor getDescriptor(String id) {
        Entry e = entry(id);
        return e != null ? e.getDescriptor() : null;
    }

    @Override
    public boolean isRegistered(String id) {
        return entry(id) != null;
    }

    @Override
    public Set<ComponentDescriptor> allDescriptors() {
        Map<String, ComponentDescriptor> sorted = new TreeMap<>();
        entries.forEach((id, e) -> sorted.put(id, e.getDescriptor()));
        return Collections.unmodifiableSet(new LinkedHashSet<>(sorted.values()));
    }

    /** Registered descriptors currently in {@code state}, ordered by id. */
    public List<ComponentDescriptor> getByState(ComponentState state) {
        List<ComponentDescriptor> out = new ArrayList<>();
        for (ComponentDescriptor d : allDescriptors()) {
            if (d.getState() == state) out.add(d);
        }
        return out;
    }

    /**
     * Removes the entry for {@code id}; no-op if absent.
     *
     * @return true if an entry was removed
     */
    public boolean unregister(String id) {
        return id != null && entries.remove(id.trim()) != null;
    }

    public int size() {
        return entries.size();
    }

    /** Removes all entries (mainly for tests). */
    public void clear() {
        entries.clear();
    }

    /** Live view of this registry that cannot be cast back to it; handed to components. */
    public ComponentLookup readOnlyView() {
        return readOnly;
    }

    private Entry entry(String id) {
        if (id == null || id.isBlank()) return null;
        return entries.get(id.trim());
    }

    private static final class ReadOnlyLookup implements ComponentLookup {
        private final ComponentLookup delegate;

        ReadOnlyLookup(ComponentLookup delegate) {
            this.delegate = delegate;
        }

        @Override
        public PluggableComponent get(String id) {
            return delegate.get(id);
        }

        @Override
        public ComponentDescriptor getDescriptor(String id) {
            return delegate.getDescriptor(id);
        }

        @Override
        public boolean isRegistered(String id) {
            return delegate.isRegistered(id);
        }

        @Override
        public Set<ComponentDescriptor> allDescriptors() {
            return delegate.allDescriptors();
        }
    }

    private static final class Entry {
        private final PluggableComponent instance;
        private final ComponentDescriptor descriptor;

        Entry(PluggableComponent instance, ComponentDescriptor descriptor) {
            this.instance = instance;
            this.descriptor = descriptor;
        }

        PluggableComponent getInstance() {
            return instance;
        }

        ComponentDescriptor getDescriptor() {
            return descriptor;
        }
    }
}
