package com.conduit.config;

import com.conduit.annotations.IsolationLevel;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConduitConfigTest {

    @Test
    void fromEnvironment_appliesDefaultsWhenUnset() {
        ConduitConfig config = ConduitConfig.fromEnvironment(Map.of());

        assertEquals(Path.of("components"), config.getComponentsDir());
        assertFalse(config.isComponentsRequired());
        assertTrue(config.getSharedPackages().isEmpty());
        assertEquals(IsolationLevel.STANDARD, config.getDefaultIsolation());
        assertEquals(Duration.ofSeconds(30), config.getChainTimeout());
        assertEquals(1, config.getStartParallelism());
        assertEquals(ResolutionFailurePolicy.ABORT_ALL, config.getResolutionPolicy());
    }

    @Test
    void fromEnvironment_readsAllVariables() {
        ConduitConfig config = ConduitConfig.fromEnvironment(Map.of(
                "CONDUIT_COMPONENTS_DIR", "/opt/conduit/components",
                "CONDUIT_COMPONENTS_REQUIRED", "true",
                "CONDUIT_SHARED_PACKAGES", " com.fasterxml.jackson , ,org.yaml",
                "CONDUIT_DEFAULT_ISOLATION", "strict",
                "CONDUIT_CHAIN_TIMEOUT_MS", "0",
                "CONDUIT_START_PARALLELISM", "4",
                "CONDUIT_RESOLUTION_POLICY", "fail_dependents"));

        assertEquals(Path.of("/opt/conduit/components"), config.getComponentsDir());
        assertTrue(config.isComponentsRequired());
        assertEquals(List.of("com.fasterxml.jackson", "org.yaml"), config.getSharedPackages());
        assertEquals(IsolationLevel.STRICT, config.getDefaultIsolation());
        assertFalse(config.hasChainTimeout());
        assertEquals(4, config.getStartParallelism());
        assertEquals(ResolutionFailurePolicy.FAIL_DEPENDENTS, config.getResolutionPolicy());
    }

    @Test
    void fromEnvironment_fallsBackOnInvalidValues() {
        ConduitConfig config = ConduitConfig.fromEnvironment(Map.of(
                "CONDUIT_DEFAULT_ISOLATION", "paranoid",
                "CONDUIT_CHAIN_TIMEOUT_MS", "soon",
                "CONDUIT_START_PARALLELISM", "-3",
                "CONDUIT_RESOLUTION_POLICY", "maybe"));

        assertEquals(IsolationLevel.STANDARD, config.getDefaultIsolation());
        assertEquals(Duration.ofSeconds(30), config.getChainTimeout());
        assertEquals(1, config.getStartParallelism());
        assertEquals(ResolutionFailurePolicy.ABORT_ALL, config.getResolutionPolicy());
    }

    @Test
    void builder_validatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> ConduitConfig.builder().startParallelism(0));
        assertThrows(IllegalArgumentException.class, () -> ConduitConfig.builder().chainTimeout(Duration.ofMillis(-1)));
    }
}
