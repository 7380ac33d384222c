package com.conduit.component.isolation;

import com.conduit.annotations.IsolationLevel;
import com.conduit.component.IsolationRequirements;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IsolationPolicyTest {

    private static LoadBoundary boundary(IsolationLevel level, Set<String> allowed, Set<String> blocked,
                                         String... privateClasses) {
        return LoadBoundary.of("acme.test", IsolationRequirements.of(level, allowed, blocked),
                SharedCore.defaults(), List.of(privateClasses));
    }

    @Test
    void blockedModuleIsRejected() {
        LoadBoundary b = boundary(IsolationLevel.STANDARD, Set.of(), Set.of("X"));

        assertEquals(ModuleSource.REJECTED, IsolationPolicy.resolve(b, "X"));
        assertEquals(ModuleSource.REJECTED, IsolationPolicy.resolve(b, "X.Inner"));
        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "XY"));
    }

    @Test
    void moduleOutsideAllowListIsRejectedEvenIfNotBlocked() {
        LoadBoundary b = boundary(IsolationLevel.STANDARD, Set.of("Y"), Set.of());

        assertEquals(ModuleSource.REJECTED, IsolationPolicy.resolve(b, "Z"));
        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "Y"));
    }

    @Test
    void moduleOnBothListsIsRejected() {
        LoadBoundary b = boundary(IsolationLevel.STANDARD, Set.of("com.lib"), Set.of("com.lib"));

        assertEquals(ModuleSource.REJECTED, IsolationPolicy.resolve(b, "com.lib.Client"));
    }

    @Test
    void sharedCoreWinsAtEveryLevelEvenWhenBlockedOrPrivate() {
        for (IsolationLevel level : IsolationLevel.values()) {
            LoadBoundary b = boundary(level, Set.of("com.only"), Set.of("java.util"), "org.slf4j.Logger");

            assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "java.util.List"), level.name());
            assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "org.slf4j.Logger"), level.name());
            assertEquals(ModuleSource.SHARED_CORE,
                    IsolationPolicy.resolve(b, "com.conduit.component.PluggableComponent"), level.name());
        }
    }

    @Test
    void levelNoneIgnoresAllowAndBlockLists() {
        LoadBoundary b = boundary(IsolationLevel.NONE, Set.of("Y"), Set.of("X"), "X.Impl");

        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "X.Impl"));
        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "Z"));
    }

    @Test
    void standardLevelPrefersPrivateCopy() {
        LoadBoundary b = boundary(IsolationLevel.STANDARD, Set.of(), Set.of(), "com.fasterxml.jackson.databind.ObjectMapper");

        assertEquals(ModuleSource.PRIVATE, IsolationPolicy.resolve(b, "com.fasterxml.jackson.databind.ObjectMapper"));
        assertEquals(ModuleSource.PRIVATE, IsolationPolicy.resolve(b, "com.fasterxml.jackson.databind"));
        assertEquals(ModuleSource.PRIVATE, IsolationPolicy.resolve(b, "com.fasterxml.jackson"));
        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "com.fasterxml.jackson.core.JsonParser"));
    }

    @Test
    void strictLevelFallsBackToHostInsteadOfPrivateCopy() {
        LoadBoundary b = boundary(IsolationLevel.STRICT, Set.of(), Set.of(), "com.lib.Client");

        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "com.lib.Client"));
    }

    @Test
    void extraSharedModulesComeFromConfiguration() {
        LoadBoundary b = LoadBoundary.of("acme.test",
                IsolationRequirements.of(IsolationLevel.STANDARD, Set.of(), Set.of("com.fasterxml")),
                SharedCore.withExtras(List.of("com.fasterxml.jackson")), List.of());

        assertEquals(ModuleSource.SHARED_CORE, IsolationPolicy.resolve(b, "com.fasterxml.jackson.databind.JsonNode"));
        assertEquals(ModuleSource.REJECTED, IsolationPolicy.resolve(b, "com.fasterxml.other.Thing"));
    }

    @Test
    void checkThrowsRestrictedModule() {
        LoadBoundary b = boundary(IsolationLevel.STRICT, Set.of(), Set.of("com.evil"));

        RestrictedModuleException e = assertThrows(RestrictedModuleException.class, () -> b.check("com.evil.Payload"));
        assertEquals("acme.test", e.getComponentId());
        assertEquals("com.evil.Payload", e.getModuleName());
    }
}
