package com.conduit.lifecycle;

import com.conduit.annotations.ResourceCleanup;
import com.conduit.component.ComponentContext;
import com.conduit.component.ComponentDescriptor;
import com.conduit.component.ComponentLookup;
import com.conduit.component.ComponentRegistry;
import com.conduit.component.ComponentState;
import com.conduit.component.ComponentValidator;
import com.conduit.component.PluggableComponent;
import com.conduit.component.dependency.CyclicDependencyException;
import com.conduit.component.dependency.DependencyGraph;
import com.conduit.component.dependency.DependencyResolutionException;
import com.conduit.component.dependency.DependencyResolver;
import com.conduit.component.dependency.UnknownDependencyException;
import com.conduit.component.isolation.ComponentLoadException;
import com.conduit.component.isolation.ComponentLoader;
import com.conduit.component.isolation.LoadBoundary;
import com.conduit.component.isolation.RestrictedModuleException;
import com.conduit.component.isolation.SharedCore;
import com.conduit.config.ResolutionFailurePolicy;
import com.conduit.pipeline.ActiveChain;
import com.conduit.pipeline.BehaviorContribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives components through their lifecycle in dependency order.
 * <p>
 * {@link #startAll(Collection)} validates and resolves a batch of descriptors, then for each component in
 * start order creates its {@link LoadBoundary}, loads it with the first {@link ComponentLoader} that supports
 * it, attaches it, registers it in the {@link ComponentRegistry} once running and splices its behaviors into
 * the {@link ActiveChain}. Starting is best effort: a component that fails is marked
 * {@link ComponentState#FAILED}, its dependents are failed without being attempted, and unrelated components
 * keep starting. No operation throws for one component's failure; failures are returned in a
 * {@link LifecycleReport} and kept in {@link #getErrors()}.
 * <p>
 * {@link #stopAll()} stops running components in the reverse of the order they started.
 * {@link #hotReload(String)} replaces one running component under a new boundary; its behaviors are out of
 * the chain while it reloads, and stay out if the reload fails.
 */
public final class ComponentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ComponentLifecycleManager.class);

    private static final Set<ComponentState> RESTARTABLE = EnumSet.of(
            ComponentState.REGISTERED, ComponentState.STOPPED, ComponentState.FAILED, ComponentState.UNLOADED);

    private final ComponentRegistry registry;
    private final ComponentLookup lookup;
    private final ActiveChain activeChain;
    private final List<ComponentLoader> loaders;
    private final SharedCore sharedCore;
    private final ResolutionFailurePolicy resolutionPolicy;
    private final int startParallelism;
    private final Map<String, String> properties;
    private final List<ComponentLifecycleListener> listeners;

    private final Map<String, Managed> managed = new ConcurrentHashMap<>();
    /**
     * Ids in the order they reached RUNNING. A successfully reloaded component keeps its position; one that
     * leaves RUNNING through a failure is removed, so a later start appends it again.
     */
    private final Set<String> started = new LinkedHashSet<>();
    private final List<ComponentError> errors = new CopyOnWriteArrayList<>();

    private ComponentLifecycleManager(Builder b) {
        this.registry = b.registry != null ? b.registry : new ComponentRegistry();
        this.lookup = registry.readOnlyView();
        this.activeChain = b.activeChain != null ? b.activeChain : new ActiveChain();
        this.loaders = List.copyOf(b.loaders);
        this.sharedCore = b.sharedCore != null ? b.sharedCore : SharedCore.defaults();
        this.resolutionPolicy = b.resolutionPolicy;
        this.startParallelism = b.startParallelism;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.listeners = new CopyOnWriteArrayList<>(b.listeners);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ComponentRegistry getRegistry() {
        return registry;
    }

    public ActiveChain getActiveChain() {
        return activeChain;
    }

    public ResolutionFailurePolicy getResolutionPolicy() {
        return resolutionPolicy;
    }

    public void addListener(ComponentLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Starts a batch of components. Components of the batch may depend on each other and on components
     * already running from an earlier batch.
     */
    public synchronized LifecycleReport startAll(Collection<ComponentDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        Recorder rec = new Recorder();
        Map<String, ComponentDescriptor> batch = new TreeMap<>();
        List<String> inputOrder = new ArrayList<>();

        for (ComponentDescriptor d : descriptors) {
            String id = d.getId();
            if (batch.containsKey(id)) {
                rec.record(ComponentError.of(id, ComponentErrorCode.DUPLICATE_REGISTRATION,
                        "Component " + id + " appears more than once in the batch"));
                continue;
            }
            Managed existing = managed.get(id);
            if (existing != null && !RESTARTABLE.contains(existing.descriptor.getState())) {
                rec.record(ComponentError.of(id, ComponentErrorCode.DUPLICATE_REGISTRATION,
                        "Component " + id + " is already " + existing.descriptor.getState()));
                continue;
            }
            Managed m = new Managed(d);
            managed.put(id, m);
            inputOrder.add(id);
            List<String> problems = ComponentValidator.validate(d);
            if (!problems.isEmpty()) {
                fail(m, rec, ComponentErrorCode.INVALID_DESCRIPTOR,
                        "Invalid descriptor for component " + id + ": " + String.join("; ", problems), null);
                continue;
            }
            batch.put(id, d);
        }

        DependencyGraph graph = graphOf(batch);
        List<String> order = resolveStartOrder(graph, batch, rec);
        if (order != null) {
            runStarts(order, rec);
        }

        Map<String, ComponentState> outcomes = new LinkedHashMap<>();
        if (order != null) {
            order.forEach(id -> outcomes.put(id, stateOf(id)));
        }
        inputOrder.forEach(id -> outcomes.putIfAbsent(id, stateOf(id)));
        LifecycleReport report = new LifecycleReport(outcomes, order != null ? order : List.of(), rec.snapshot());
        log.info("Started {} of {} component(s); order={}, failed={}",
                report.inState(ComponentState.RUNNING).size(), outcomes.size(), report.getOrder(), report.getFailed());
        return report;
    }

    /**
     * Stops every running component, dependents before their dependencies.
     */
    public synchronized LifecycleReport stopAll() {
        Recorder rec = new Recorder();
        List<String> order;
        synchronized (started) {
            order = new ArrayList<>(started);
            started.clear();
        }
        Collections.reverse(order);
        Map<String, ComponentState> outcomes = new LinkedHashMap<>();
        for (String id : order) {
            Managed m = managed.get(id);
            if (m == null) continue;
            m.lock.lock();
            try {
                stopOne(m, rec);
            } finally {
                m.lock.unlock();
            }
            outcomes.put(id, m.descriptor.getState());
        }
        log.info("Stopped {} component(s) in order {}", outcomes.size(), order);
        return new LifecycleReport(outcomes, order, rec.snapshot());
    }

    /**
     * Stops, unloads and restarts one running component under a new load boundary. Components depending on
     * it keep running. Reloads, starts and stops run one after the other, so no batch start can replace a
     * component while it is between STOPPED and RUNNING.
     */
    public synchronized LifecycleReport hotReload(String componentId) {
        Objects.requireNonNull(componentId, "componentId");
        Recorder rec = new Recorder();
        Managed m = managed.get(componentId);
        if (m == null) {
            rec.record(ComponentError.of(componentId, ComponentErrorCode.NOT_RUNNING,
                    "Cannot reload unknown component " + componentId));
            return new LifecycleReport(Map.of(), List.of(), rec.snapshot());
        }
        m.lock.lock();
        try {
            ComponentState state = m.descriptor.getState();
            if (state != ComponentState.RUNNING) {
                rec.record(ComponentError.of(componentId, ComponentErrorCode.NOT_RUNNING,
                        "Cannot reload component " + componentId + " in state " + state));
            } else {
                log.info("Hot reload of component {} started", componentId);
                if (stopOne(m, rec)) {
                    transition(m, ComponentState.UNLOADED);
                    startOne(m, rec);
                }
                if (m.descriptor.getState() == ComponentState.RUNNING) {
                    log.info("Hot reload of component {} completed", componentId);
                } else {
                    log.warn("Hot reload of component {} failed; component left {}", componentId, m.descriptor.getState());
                }
            }
            return new LifecycleReport(Map.of(componentId, m.descriptor.getState()), List.of(componentId), rec.snapshot());
        } finally {
            m.lock.unlock();
        }
    }

    /** Current state of a component; null if this manager never saw it. */
    public ComponentState getState(String componentId) {
        Managed m = managed.get(componentId);
        return m != null ? m.descriptor.getState() : null;
    }

    public ComponentDescriptor getDescriptor(String componentId) {
        Managed m = managed.get(componentId);
        return m != null ? m.descriptor : null;
    }

    /** Every error recorded since this manager was created, oldest first. */
    public List<ComponentError> getErrors() {
        return List.copyOf(errors);
    }

    public List<ComponentError> getErrors(String componentId) {
        return errors.stream().filter(e -> e.getComponentId().equals(componentId)).collect(Collectors.toList());
    }

    /** Running components in the order they started. */
    public List<String> getStartedOrder() {
        synchronized (started) {
            return started.stream().filter(id -> stateOf(id) == ComponentState.RUNNING).collect(Collectors.toList());
        }
    }

    private DependencyGraph graphOf(Map<String, ComponentDescriptor> batch) {
        Map<String, Set<String>> edges = new TreeMap<>();
        for (ComponentDescriptor d : batch.values()) {
            Set<String> deps = new TreeSet<>();
            for (String dep : d.getDependencies()) {
                // Components managed outside this batch are checked when the dependent starts.
                if (batch.containsKey(dep) || !managed.containsKey(dep)) {
                    deps.add(dep);
                }
            }
            edges.put(d.getId(), deps);
        }
        return DependencyGraph.fromEdges(edges);
    }

    /**
     * @return start order of the components that may start; null if the whole batch was aborted
     */
    private List<String> resolveStartOrder(DependencyGraph graph, Map<String, ComponentDescriptor> batch, Recorder rec) {
        Map<String, Set<String>> unknown = graph.getUnknownDependencies();
        Set<String> cyclic = graph.getCycleMembers();
        if (unknown.isEmpty() && cyclic.isEmpty()) {
            return DependencyResolver.resolve(graph).getStartOrder();
        }

        Set<String> offenders = new TreeSet<>(unknown.keySet());
        offenders.addAll(cyclic);
        unknown.forEach((id, deps) -> fail(managed.get(id), rec, ComponentErrorCode.UNKNOWN_DEPENDENCY,
                "Component " + id + " depends on unknown component(s) " + deps,
                new UnknownDependencyException(id, deps.iterator().next())));
        if (!cyclic.isEmpty()) {
            CyclicDependencyException cycle = cycleIn(graph.subgraph(cyclic));
            for (String id : cyclic) {
                fail(managed.get(id), rec, ComponentErrorCode.CYCLIC_DEPENDENCY,
                        "Component " + id + " is part of a dependency cycle (" + cycle.getMessage() + ")", cycle);
            }
        }

        if (resolutionPolicy == ResolutionFailurePolicy.ABORT_ALL) {
            for (String id : batch.keySet()) {
                if (!offenders.contains(id)) {
                    rec.record(ComponentError.of(id, ComponentErrorCode.RESOLUTION_ABORTED,
                            "Start of component " + id + " aborted: dependency resolution failed for " + offenders));
                }
            }
            return null;
        }

        Set<String> excluded = new TreeSet<>(offenders);
        for (String offender : offenders) {
            for (String dependent : graph.getTransitiveDependents(offender)) {
                if (excluded.add(dependent)) {
                    fail(managed.get(dependent), rec, ComponentErrorCode.DEPENDENCY_FAILED,
                            "Component " + dependent + " not started: it depends on unresolvable component " + offender,
                            null);
                }
            }
        }
        Set<String> remaining = new TreeSet<>(batch.keySet());
        remaining.removeAll(excluded);
        return DependencyResolver.resolve(graph.subgraph(remaining)).getStartOrder();
    }

    private static CyclicDependencyException cycleIn(DependencyGraph cyclic) {
        try {
            DependencyResolver.resolve(cyclic);
        } catch (CyclicDependencyException e) {
            return e;
        } catch (DependencyResolutionException e) {
            throw new IllegalStateException("Unexpected resolution failure for cycle members " + cyclic.nodes(), e);
        }
        throw new IllegalStateException("Cycle members resolved without a cycle: " + cyclic.nodes());
    }

    private void runStarts(List<String> order, Recorder rec) {
        if (startParallelism <= 1 || order.size() <= 1) {
            for (String id : order) {
                Managed m = managed.get(id);
                m.lock.lock();
                try {
                    startOne(m, rec);
                } finally {
                    m.lock.unlock();
                }
            }
            return;
        }
        AtomicInteger threads = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(startParallelism, r -> {
            Thread t = new Thread(r, "conduit-start-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, CompletableFuture<Void>> futures = new HashMap<>();
            for (String id : order) {
                Managed m = managed.get(id);
                CompletableFuture<?>[] deps = m.descriptor.getDependencies().stream()
                        .map(futures::get)
                        .filter(Objects::nonNull)
                        .toArray(CompletableFuture[]::new);
                futures.put(id, CompletableFuture.allOf(deps).thenRunAsync(() -> {
                    m.lock.lock();
                    try {
                        startOne(m, rec);
                    } finally {
                        m.lock.unlock();
                    }
                }, pool));
            }
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Takes one component from a restartable state to RUNNING. Caller holds the component's lock.
     */
    private void startOne(Managed m, Recorder rec) {
        ComponentDescriptor d = m.descriptor;
        String id = d.getId();
        try {
            List<String> notRunning = d.getDependencies().stream()
                    .filter(dep -> stateOf(dep) != ComponentState.RUNNING)
                    .sorted()
                    .collect(Collectors.toList());
            if (!notRunning.isEmpty()) {
                fail(m, rec, ComponentErrorCode.DEPENDENCY_FAILED,
                        "Component " + id + " not started: dependencies not running " + notRunning, null);
                return;
            }
            transition(m, ComponentState.RESOLVED);

            ComponentLoader loader = loaderFor(d);
            if (loader == null) {
                fail(m, rec, ComponentErrorCode.NO_LOADER, "No loader supports component " + id, null);
                return;
            }
            try {
                m.boundary = LoadBoundary.create(d, sharedCore);
            } catch (ComponentLoadException e) {
                fail(m, rec, ComponentErrorCode.LOAD_FAILED, e.getMessage(), e);
                return;
            }

            PluggableComponent instance;
            try {
                for (String module : d.getRequiredModules()) {
                    m.boundary.check(module);
                }
                transition(m, ComponentState.INITIALIZING);
                instance = loader.load(d, m.boundary);
            } catch (RestrictedModuleException e) {
                failAndRelease(m, rec, ComponentErrorCode.RESTRICTED_MODULE, e.getMessage(), e);
                return;
            } catch (ComponentLoadException e) {
                failAndRelease(m, rec, ComponentErrorCode.LOAD_FAILED, e.getMessage(), e);
                return;
            }

            try {
                instance.onAttach(new ComponentContext(d, lookup, properties));
            } catch (Exception e) {
                failAndRelease(m, rec, ComponentErrorCode.ATTACH_FAILED,
                        "Component " + id + " failed to attach: " + e.getMessage(), e);
                return;
            }
            m.instance = instance;
            transition(m, ComponentState.INITIALIZED);
            transition(m, ComponentState.STARTING);

            List<BehaviorContribution> contributions;
            try {
                contributions = instance.contributeBehaviors();
            } catch (RuntimeException e) {
                detach(m, rec);
                failAndRelease(m, rec, ComponentErrorCode.CONTRIBUTION_FAILED,
                        "Component " + id + " failed to contribute behaviors: " + e.getMessage(), e);
                return;
            }
            transition(m, ComponentState.RUNNING);
            if (!registry.register(id, instance, d)) {
                detach(m, rec);
                failAndRelease(m, rec, ComponentErrorCode.DUPLICATE_REGISTRATION,
                        "Component id " + id + " is already registered", null);
                return;
            }
            activeChain.splice(id, contributions != null ? contributions : List.of());
            synchronized (started) {
                started.add(id);
            }
            log.info("Component {} {} running ({} behavior(s))", id, d.getVersion(),
                    contributions != null ? contributions.size() : 0);
        } catch (RuntimeException e) {
            // Invalid transition or a loader bug; must not escape into the start pool.
            failAndRelease(m, rec, ComponentErrorCode.LOAD_FAILED,
                    "Component " + id + " failed to start: " + e.getMessage(), e);
        }
    }

    /**
     * RUNNING to STOPPED: out of the chain, detached, unregistered, boundary released. Caller holds the lock.
     *
     * @return true if the component reached STOPPED
     */
    private boolean stopOne(Managed m, Recorder rec) {
        ComponentDescriptor d = m.descriptor;
        String id = d.getId();
        if (d.getState() != ComponentState.RUNNING) {
            release(m);
            return false;
        }
        transition(m, ComponentState.STOPPING);
        activeChain.remove(id);
        boolean detached = detach(m, rec);
        registry.unregister(id);
        release(m);
        if (!detached) {
            fail(m, rec, null, null, null);
            return false;
        }
        transition(m, ComponentState.STOPPED);
        log.info("Component {} stopped", id);
        return true;
    }

    /** onDetach then {@link ResourceCleanup#onExit()}; returns false if onDetach threw. */
    private boolean detach(Managed m, Recorder rec) {
        PluggableComponent instance = m.instance;
        String id = m.descriptor.getId();
        if (instance == null) {
            return true;
        }
        boolean ok = true;
        try {
            instance.onDetach();
        } catch (Exception e) {
            rec.record(ComponentError.of(id, ComponentErrorCode.DETACH_FAILED,
                    "Component " + id + " failed to detach: " + e.getMessage(), e));
            ok = false;
        }
        if (instance instanceof ResourceCleanup) {
            try {
                ((ResourceCleanup) instance).onExit();
            } catch (RuntimeException e) {
                rec.record(ComponentError.of(id, ComponentErrorCode.CLEANUP_FAILED,
                        "Component " + id + " failed to release resources: " + e.getMessage(), e));
            }
        }
        return ok;
    }

    private ComponentLoader loaderFor(ComponentDescriptor d) {
        for (ComponentLoader loader : loaders) {
            if (loader.supports(d)) {
                return loader;
            }
        }
        return null;
    }

    private ComponentState stateOf(String id) {
        Managed m = managed.get(id);
        return m != null ? m.descriptor.getState() : null;
    }

    private void transition(Managed m, ComponentState next) {
        ComponentState previous = m.descriptor.transitionTo(next);
        log.debug("Component {}: {} -> {}", m.descriptor.getId(), previous, next);
        publish(l -> l.onTransition(m.descriptor, previous, next));
    }

    private void failAndRelease(Managed m, Recorder rec, ComponentErrorCode code, String message, Throwable cause) {
        release(m);
        fail(m, rec, code, message, cause);
    }

    /** Marks the component FAILED and records the error; a null code records nothing. */
    private void fail(Managed m, Recorder rec, ComponentErrorCode code, String message, Throwable cause) {
        synchronized (started) {
            started.remove(m.descriptor.getId());
        }
        ComponentState previous = m.descriptor.markFailed();
        if (previous != ComponentState.FAILED) {
            publish(l -> l.onTransition(m.descriptor, previous, ComponentState.FAILED));
        }
        if (code != null) {
            rec.record(ComponentError.of(m.descriptor.getId(), code, message, cause));
        }
    }

    private void release(Managed m) {
        m.instance = null;
        LoadBoundary boundary = m.boundary;
        m.boundary = null;
        if (boundary != null) {
            boundary.close();
        }
    }

    private void publish(Consumer<ComponentLifecycleListener> event) {
        for (ComponentLifecycleListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }

    private static final class Managed {
        final ReentrantLock lock = new ReentrantLock();
        final ComponentDescriptor descriptor;
        volatile PluggableComponent instance;
        volatile LoadBoundary boundary;

        Managed(ComponentDescriptor descriptor) {
            this.descriptor = descriptor;
        }
    }

    /** Errors of one operation; each is also added to the manager's history and published. */
    private final class Recorder {
        private final List<ComponentError> recorded = Collections.synchronizedList(new ArrayList<>());

        void record(ComponentError error) {
            recorded.add(error);
            errors.add(error);
            if (error.getCause() != null && error.getSeverity().isAtLeast(ErrorSeverity.ERROR)) {
                log.error("{}", error, error.getCause());
            } else {
                log.warn("{}", error);
            }
            publish(l -> l.onError(error));
        }

        List<ComponentError> snapshot() {
            synchronized (recorded) {
                return new ArrayList<>(recorded);
            }
        }
    }

    public static final class Builder {
        private ComponentRegistry registry;
        private ActiveChain activeChain;
        private final List<ComponentLoader> loaders = new ArrayList<>();
        private SharedCore sharedCore;
        private ResolutionFailurePolicy resolutionPolicy = ResolutionFailurePolicy.ABORT_ALL;
        private int startParallelism = 1;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final List<ComponentLifecycleListener> listeners = new ArrayList<>();

        public Builder registry(ComponentRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder activeChain(ActiveChain activeChain) {
            this.activeChain = activeChain;
            return this;
        }

        /** Adds a loader; loaders are asked in the order added. */
        public Builder loader(ComponentLoader loader) {
            loaders.add(Objects.requireNonNull(loader, "loader"));
            return this;
        }

        public Builder sharedCore(SharedCore sharedCore) {
            this.sharedCore = sharedCore;
            return this;
        }

        public Builder resolutionPolicy(ResolutionFailurePolicy resolutionPolicy) {
            this.resolutionPolicy = Objects.requireNonNull(resolutionPolicy, "resolutionPolicy");
            return this;
        }

        public Builder startParallelism(int startParallelism) {
            if (startParallelism < 1) {
                throw new IllegalArgumentException("startParallelism must be >= 1");
            }
            this.startParallelism = startParallelism;
            return this;
        }

        /** Properties handed to every component in its {@link ComponentContext}. */
        public Builder properties(Map<String, String> properties) {
            if (properties != null) {
                this.properties.putAll(properties);
            }
            return this;
        }

        public Builder listener(ComponentLifecycleListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public ComponentLifecycleManager build() {
            return new ComponentLifecycleManager(this);
        }
    }
}
