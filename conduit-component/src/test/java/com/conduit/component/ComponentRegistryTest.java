package com.conduit.component;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentRegistryTest {

    private final ComponentRegistry registry = new ComponentRegistry();

    private static ComponentDescriptor descriptor(String id, String version) {
        return ComponentDescriptor.builder(id).version(version).build();
    }

    @Test
    void register_secondRegistrationForSameIdIsRejectedAndFirstIsKept() {
        StubComponent first = new StubComponent("acme.a");
        ComponentDescriptor firstDescriptor = descriptor("acme.a", "1.0.0");

        assertTrue(registry.register("acme.a", first, firstDescriptor));
        assertFalse(registry.register("acme.a", new StubComponent("acme.a"), descriptor("acme.a", "2.0.0")));

        assertSame(first, registry.get("acme.a"));
        assertSame(firstDescriptor, registry.getDescriptor("acme.a"));
        assertEquals("1.0.0", registry.getDescriptor("acme.a").getVersion());
        assertEquals(1, registry.size());
    }

    @Test
    void registerOrThrow_throwsOnDuplicate() {
        registry.registerOrThrow("acme.a", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0"));

        DuplicateRegistrationException e = assertThrows(DuplicateRegistrationException.class,
                () -> registry.registerOrThrow("acme.a", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0")));
        assertEquals("acme.a", e.getComponentId());
    }

    @Test
    void register_rejectsBlankOrMismatchedId() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(" ", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0")));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("acme.b", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0")));
        assertEquals(0, registry.size());
    }

    @Test
    void lookups_returnNullForUnknownId() {
        assertNull(registry.get("missing"));
        assertNull(registry.getDescriptor("missing"));
        assertNull(registry.get(null));
        assertFalse(registry.isRegistered("missing"));
    }

    @Test
    void getTyped_returnsInstanceOnlyForMatchingType() {
        registry.register("acme.a", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0"));

        assertTrue(registry.get("acme.a", StubComponent.class) instanceof StubComponent);
        assertNull(registry.get("acme.a", String.class));
    }

    @Test
    void unregister_removesEntryAndIsNoOpWhenAbsent() {
        registry.register("acme.a", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0"));

        assertTrue(registry.unregister("acme.a"));
        assertFalse(registry.isRegistered("acme.a"));
        assertFalse(registry.unregister("acme.a"));
    }

    @Test
    void readOnlyView_tracksRegistryButCannotMutateIt() {
        ComponentLookup view = registry.readOnlyView();
        StubComponent a = new StubComponent("acme.a");
        registry.register("acme.a", a, descriptor("acme.a", "1.0.0"));

        assertFalse(view instanceof ComponentRegistry);
        assertSame(a, view.get("acme.a"));
        assertEquals("1.0.0", view.getDescriptor("acme.a").getVersion());
        assertEquals(1, view.allDescriptors().size());

        registry.unregister("acme.a");
        assertFalse(view.isRegistered("acme.a"));
    }

    @Test
    void allDescriptors_isSnapshotOrderedById() {
        registry.register("acme.c", new StubComponent("acme.c"), descriptor("acme.c", "1.0.0"));
        registry.register("acme.a", new StubComponent("acme.a"), descriptor("acme.a", "1.0.0"));

        Set<ComponentDescriptor> snapshot = registry.allDescriptors();
        registry.register("acme.b", new StubComponent("acme.b"), descriptor("acme.b", "1.0.0"));

        List<String> ids = new ArrayList<>();
        snapshot.forEach(d -> ids.add(d.getId()));
        assertEquals(List.of("acme.a", "acme.c"), ids);
        assertEquals(3, registry.allDescriptors().size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
    }

    @Test
    void getByState_filtersOnCurrentState() {
        ComponentDescriptor running = descriptor("acme.a", "1.0.0");
        running.transitionTo(ComponentState.RESOLVED);
        registry.register("acme.a", new StubComponent("acme.a"), running);
        registry.register("acme.b", new StubComponent("acme.b"), descriptor("acme.b", "1.0.0"));

        assertEquals(List.of(running), registry.getByState(ComponentState.RESOLVED));
        assertEquals(1, registry.getByState(ComponentState.REGISTERED).size());
    }

    @Test
    void register_concurrentRegistrationsOfSameIdHaveExactlyOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return registry.register("acme.race", new StubComponent("acme.race"), descriptor("acme.race", "1.0.0"));
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertEquals(1, winners);
            assertEquals(1, registry.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
