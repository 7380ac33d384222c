package com.conduit.bootstrap;

import com.conduit.annotations.ConduitComponent;
import com.conduit.component.AbstractPluggableComponent;
import com.conduit.component.ComponentState;
import com.conduit.component.PluggableComponent;
import com.conduit.config.ConduitConfig;
import com.conduit.lifecycle.LifecycleReport;
import com.conduit.pipeline.BehaviorContribution;
import com.conduit.pipeline.PipelineTimeoutException;
import org.example.echo.EchoComponent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConduitBootstrapTest {

    private static final String ECHO_MANIFEST =
            "{\"id\":\"example.echo\",\"name\":\"Echo\",\"version\":\"1.0.0\","
                    + "\"entryPoint\":\"org.example.echo.EchoComponent\"}";

    @TempDir
    Path tempDir;

    @ConduitComponent(id = "example.upper", dependsOn = "example.echo")
    public static final class UpperCaseComponent extends AbstractPluggableComponent {
        @Override
        public List<BehaviorContribution> contributeBehaviors() {
            return List.of(BehaviorContribution.of("upper", 1,
                    (ctx, next) -> String.valueOf(next.proceed(ctx)).toUpperCase(Locale.ROOT)));
        }
    }

    @ConduitComponent(id = "example.slow")
    public static final class SlowComponent extends AbstractPluggableComponent {
        @Override
        public List<BehaviorContribution> contributeBehaviors() {
            return List.of(BehaviorContribution.of("slow", (ctx, next) -> {
                ctx.awaitCancellation(Duration.ofSeconds(5));
                return "late";
            }));
        }
    }

    /** Exploded echo component: manifest plus the fixture's class file. */
    private Path componentsDir() throws Exception {
        Path components = tempDir.resolve("components");
        Path echo = components.resolve("echo");
        Path manifest = echo.resolve("META-INF/conduit-component.json");
        Files.createDirectories(manifest.getParent());
        Files.writeString(manifest, ECHO_MANIFEST, StandardCharsets.UTF_8);
        Path classFile = echo.resolve("org/example/echo/EchoComponent.class");
        Files.createDirectories(classFile.getParent());
        try (InputStream in = EchoComponent.class.getResourceAsStream("EchoComponent.class")) {
            Files.copy(in, classFile);
        }
        return components;
    }

    private ConduitConfig config(Path componentsDir, Duration chainTimeout) {
        return ConduitConfig.builder()
                .componentsDir(componentsDir)
                .chainTimeout(chainTimeout)
                .build();
    }

    @Test
    void initialize_wiresDiscoveredAndInternalComponents() throws Exception {
        try (ConduitRuntime runtime = ConduitBootstrap.initialize(config(componentsDir(), Duration.ofSeconds(5)),
                discovery -> discovery.registerInternal(UpperCaseComponent.class, UpperCaseComponent::new))) {

            assertEquals(2, runtime.getDescriptors().size());
            LifecycleReport report = runtime.start();

            assertTrue(report.isSuccess());
            assertEquals(List.of("example.echo", "example.upper"), report.getOrder());
            assertEquals(ComponentState.RUNNING, runtime.getState("example.echo"));
            assertEquals("ECHO:HI", runtime.process("hi"));

            PluggableComponent echo = runtime.getManager().getRegistry().get("example.echo");
            assertNotSame(EchoComponent.class, echo.getClass());
        }
    }

    @Test
    void hotReload_loadsTheComponentUnderANewClassLoader() throws Exception {
        try (ConduitRuntime runtime = ConduitBootstrap.initialize(config(componentsDir(), Duration.ZERO),
                discovery -> { })) {
            runtime.start();
            Class<?> before = runtime.getManager().getRegistry().get("example.echo").getClass();

            LifecycleReport report = runtime.hotReload("example.echo");

            assertTrue(report.isSuccess());
            Class<?> after = runtime.getManager().getRegistry().get("example.echo").getClass();
            assertNotSame(before, after);
            assertEquals(before.getName(), after.getName());
            assertEquals("echo:again", runtime.process("again"));
        }
    }

    @Test
    void process_failsWithTimeoutWhenChainOverrunsDeadline() {
        try (ConduitRuntime runtime = ConduitBootstrap.initialize(
                config(tempDir.resolve("none"), Duration.ofMillis(100)),
                discovery -> discovery.registerInternal(SlowComponent.class, SlowComponent::new))) {
            runtime.start();

            long startNanos = System.nanoTime();
            assertThrows(PipelineTimeoutException.class, () -> runtime.process("request"));
            assertTrue(Duration.ofNanos(System.nanoTime() - startNanos).compareTo(Duration.ofSeconds(4)) < 0);
        }
    }

    @Test
    void process_acceptsLargestConfigurableTimeout() throws Exception {
        ConduitConfig config = ConduitConfig.fromEnvironment(Map.of(
                "CONDUIT_COMPONENTS_DIR", componentsDir().toString(),
                "CONDUIT_CHAIN_TIMEOUT_MS", String.valueOf(Long.MAX_VALUE)));
        try (ConduitRuntime runtime = ConduitBootstrap.initialize(config, discovery -> { })) {
            runtime.start();

            assertEquals("echo:hi", runtime.process("hi"));
        }
    }

    @Test
    void start_withNoComponentsRunsEmptyChain() {
        try (ConduitRuntime runtime = ConduitBootstrap.initialize(config(tempDir.resolve("missing"), Duration.ZERO),
                discovery -> { })) {
            LifecycleReport report = runtime.start();

            assertTrue(report.isSuccess());
            assertTrue(runtime.getErrors().isEmpty());
            assertNull(runtime.process("anything"));
        }
    }

    @Test
    void close_stopsRunningComponents() throws Exception {
        ConduitRuntime runtime = ConduitBootstrap.initialize(config(componentsDir(), Duration.ZERO), discovery -> { });
        runtime.start();
        assertTrue(runtime.isStarted());

        runtime.close();

        assertFalse(runtime.isStarted());
        assertEquals(ComponentState.STOPPED, runtime.getState("example.echo"));
        assertEquals(0, runtime.getManager().getRegistry().size());
    }
}
