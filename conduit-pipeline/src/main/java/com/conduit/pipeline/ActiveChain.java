package com.conduit.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holder of the active request chain. Contributions are grouped by the component that contributed them;
 * every change (splice a component in, remove it, flip an enabled flag) builds a new immutable
 * {@link Snapshot} and swaps it in atomically. Requests take {@link #current()} once and run against that
 * chain, so a concurrent change never alters a chain an in-flight request is executing, and a component's
 * contributions appear or disappear all at once.
 */
public final class ActiveChain {

    private static final Logger log = LoggerFactory.getLogger(ActiveChain.class);

    private final Next terminal;
    private final AtomicReference<Snapshot> snapshot;

    public ActiveChain() {
        this(null);
    }

    /**
     * @param terminal continuation after the last behavior; null = return the context's current result
     */
    public ActiveChain(Next terminal) {
        this.terminal = terminal;
        this.snapshot = new AtomicReference<>(new Snapshot(Map.of(), BehaviorChain.build(List.of(), terminal), 0L));
    }

    /** Chain of the current snapshot. */
    public BehaviorChain current() {
        return snapshot.get().getChain();
    }

    public Snapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Inserts (or replaces) all contributions of a component in one swap.
     */
    public Snapshot splice(String componentId, Collection<BehaviorContribution> contributions) {
        Objects.requireNonNull(componentId, "componentId");
        List<BehaviorContribution> copy = contributions == null ? List.of() : List.copyOf(contributions);
        Snapshot next = update(byComponent -> {
            byComponent.put(componentId, copy);
            return byComponent;
        });
        log.info("Chain rebuilt (version {}): spliced {} contribution(s) of component {}; chain={}",
                next.getVersion(), copy.size(), componentId, next.getChain().behaviorIds());
        return next;
    }

    /**
     * Removes all contributions of a component in one swap.
     *
     * @return the removed contributions; empty if the component had none
     */
    public List<BehaviorContribution> remove(String componentId) {
        Objects.requireNonNull(componentId, "componentId");
        Snapshot before = snapshot.get();
        while (true) {
            List<BehaviorContribution> removed = before.getContributions().get(componentId);
            if (removed == null) {
                return List.of();
            }
            Map<String, List<BehaviorContribution>> copy = new TreeMap<>(before.getContributions());
            copy.remove(componentId);
            Snapshot next = newSnapshot(copy, before.getVersion() + 1);
            if (snapshot.compareAndSet(before, next)) {
                log.info("Chain rebuilt (version {}): removed {} contribution(s) of component {}; chain={}",
                        next.getVersion(), removed.size(), componentId, next.getChain().behaviorIds());
                return removed;
            }
            before = snapshot.get();
        }
    }

    /**
     * Sets the enabled flag of every contribution with the given id.
     *
     * @return true if any contribution changed
     */
    public boolean setEnabled(String contributionId, boolean enabled) {
        Objects.requireNonNull(contributionId, "contributionId");
        boolean[] changed = new boolean[1];
        Snapshot next = update(byComponent -> {
            changed[0] = false;
            byComponent.replaceAll((component, list) -> {
                List<BehaviorContribution> out = new ArrayList<>(list.size());
                for (BehaviorContribution c : list) {
                    if (c.getId().equals(contributionId) && c.isEnabled() != enabled) {
                        changed[0] = true;
                        out.add(c.withEnabled(enabled));
                    } else {
                        out.add(c);
                    }
                }
                return List.copyOf(out);
            });
            return byComponent;
        });
        if (changed[0]) {
            log.info("Chain rebuilt (version {}): contribution {} enabled={}", next.getVersion(), contributionId, enabled);
        }
        return changed[0];
    }

    /** Contributions of one component in the current snapshot; empty if none. */
    public List<BehaviorContribution> contributionsOf(String componentId) {
        List<BehaviorContribution> list = snapshot.get().getContributions().get(componentId);
        return list != null ? list : List.of();
    }

    public boolean contains(String componentId) {
        return snapshot.get().getContributions().containsKey(componentId);
    }

    private Snapshot update(UnaryOperator<Map<String, List<BehaviorContribution>>> change) {
        return snapshot.updateAndGet(current ->
                newSnapshot(change.apply(new TreeMap<>(current.getContributions())), current.getVersion() + 1));
    }

    private Snapshot newSnapshot(Map<String, List<BehaviorContribution>> byComponent, long version) {
        List<BehaviorContribution> all = new ArrayList<>();
        byComponent.values().forEach(all::addAll);
        return new Snapshot(Collections.unmodifiableMap(byComponent), BehaviorChain.build(all, terminal), version);
    }

    /**
     * Immutable view: contributions per component id and the chain built from them.
     */
    public static final class Snapshot {
        private final Map<String, List<BehaviorContribution>> contributions;
        private final BehaviorChain chain;
        private final long version;

        Snapshot(Map<String, List<BehaviorContribution>> contributions, BehaviorChain chain, long version) {
            this.contributions = contributions;
            this.chain = chain;
            this.version = version;
        }

        /** componentId → contributions (all, including disabled ones). */
        public Map<String, List<BehaviorContribution>> getContributions() {
            return contributions;
        }

        public BehaviorChain getChain() {
            return chain;
        }

        /** Incremented on every swap. */
        public long getVersion() {
            return version;
        }
    }
}
