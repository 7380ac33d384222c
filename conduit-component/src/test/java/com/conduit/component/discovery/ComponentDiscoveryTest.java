package com.conduit.component.discovery;

import com.conduit.annotations.ConduitComponent;
import com.conduit.annotations.IsolationLevel;
import com.conduit.component.AbstractPluggableComponent;
import com.conduit.component.ComponentDescriptor;
import com.conduit.component.isolation.ComponentLoadException;
import com.conduit.component.isolation.LoadBoundary;
import com.conduit.component.isolation.SharedCore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentDiscoveryTest {

    private static final String AUDIT_MANIFEST = """
            {"id":"acme.audit","name":"Audit","version":"1.2.0","entryPoint":"com.acme.audit.AuditComponent",
             "dependencies":["acme.core"],
             "isolation":{"level":"STRICT","allowedModules":["com.acme"],"blockedModules":["com.acme.internal"]},
             "requiredModules":["com.acme.audit"],
             "unknownField":true}
            """;

    private static final String CORE_MANIFEST = """
            {"id":"acme.core","version":"1.0.0","entryPoint":"com.acme.core.CoreComponent"}
            """;

    @TempDir
    Path tempDir;

    @ConduitComponent(id = "acme.builtin", dependsOn = "acme.core")
    public static final class BuiltinComponent extends AbstractPluggableComponent {
    }

    private void writeJar(Path jar, String manifest) throws Exception {
        try (OutputStream out = Files.newOutputStream(jar); JarOutputStream jos = new JarOutputStream(out)) {
            jos.putNextEntry(new JarEntry(ComponentManifest.RESOURCE));
            jos.write(manifest.getBytes(StandardCharsets.UTF_8));
            jos.closeEntry();
        }
    }

    private void writeDirectory(Path dir, String manifest) throws Exception {
        Path file = dir.resolve(ComponentManifest.RESOURCE);
        Files.createDirectories(file.getParent());
        Files.writeString(file, manifest);
    }

    @Test
    void scan_readsJarsAndExplodedDirectories() throws Exception {
        writeJar(tempDir.resolve("audit.jar"), AUDIT_MANIFEST);
        writeDirectory(tempDir.resolve("core"), CORE_MANIFEST);
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        ComponentDiscovery discovery = new ComponentDiscovery();
        List<ComponentDescriptor> found = discovery.scan(tempDir);

        assertEquals(2, found.size());
        ComponentDescriptor audit = found.get(0);
        assertEquals("acme.audit", audit.getId());
        assertEquals("1.2.0", audit.getVersion());
        assertEquals(Set.of("acme.core"), audit.getDependencies());
        assertEquals(IsolationLevel.STRICT, audit.getIsolation().getLevel());
        assertEquals(Set.of("com.acme"), audit.getIsolation().getAllowedModules());
        assertEquals(Set.of("com.acme.internal"), audit.getIsolation().getBlockedModules());
        assertEquals(Set.of("com.acme.audit"), audit.getRequiredModules());
        assertEquals(tempDir.resolve("audit.jar"), audit.getLocation());

        ComponentDescriptor core = found.get(1);
        assertEquals("acme.core", core.getId());
        assertEquals("acme.core", core.getName());
        assertEquals(IsolationLevel.STANDARD, core.getIsolation().getLevel());
        assertEquals(found, discovery.getExternalDescriptors());
    }

    @Test
    void scan_appliesConfiguredDefaultIsolation() throws Exception {
        writeDirectory(tempDir.resolve("core"), CORE_MANIFEST);

        List<ComponentDescriptor> found = new ComponentDiscovery(IsolationLevel.STRICT, false).scan(tempDir);

        assertEquals(IsolationLevel.STRICT, found.get(0).getIsolation().getLevel());
    }

    @Test
    void scan_skipsInvalidComponentWhenNotRequired() throws Exception {
        writeJar(tempDir.resolve("broken.jar"), "{not json");
        writeDirectory(tempDir.resolve("no-entry"), "{\"id\":\"acme.noentry\"}");
        Files.createDirectories(tempDir.resolve("plain-dir"));
        writeDirectory(tempDir.resolve("core"), CORE_MANIFEST);

        List<ComponentDescriptor> found = new ComponentDiscovery().scan(tempDir);

        assertEquals(1, found.size());
        assertEquals("acme.core", found.get(0).getId());
    }

    @Test
    void scan_skipsManifestWithUnconventionalId() throws Exception {
        writeDirectory(tempDir.resolve("upper"), "{\"id\":\"Acme_Upper\",\"entryPoint\":\"com.acme.Upper\"}");
        writeDirectory(tempDir.resolve("core"), CORE_MANIFEST);

        List<ComponentDescriptor> found = new ComponentDiscovery().scan(tempDir);

        assertEquals(1, found.size());
        assertEquals("acme.core", found.get(0).getId());
    }

    @Test
    void scan_failsOnInvalidComponentWhenRequired() throws Exception {
        writeJar(tempDir.resolve("broken.jar"), "{not json");

        ComponentDiscovery discovery = new ComponentDiscovery(IsolationLevel.STANDARD, true);

        ComponentLoadException e = assertThrows(ComponentLoadException.class, () -> discovery.scan(tempDir));
        assertNull(e.getComponentId());
    }

    @Test
    void scan_missingDirectoryIsEmpty() {
        assertTrue(new ComponentDiscovery().scan(tempDir.resolve("missing")).isEmpty());
        assertTrue(new ComponentDiscovery().scan(null).isEmpty());
    }

    @Test
    void registerInternal_usesAnnotationAndFactory() {
        ComponentDiscovery discovery = new ComponentDiscovery();

        ComponentDescriptor d = discovery.registerInternal(BuiltinComponent.class, BuiltinComponent::new);

        assertEquals("acme.builtin", d.getId());
        assertEquals(Set.of("acme.core"), d.getDependencies());
        assertEquals(List.of(d), discovery.getInternalDescriptors());
        assertTrue(discovery.getInternalLoader().supports(d));
        LoadBoundary boundary = LoadBoundary.create(d, SharedCore.defaults());
        assertEquals("acme.builtin", discovery.getInternalLoader().load(d, boundary).getId());
        assertThrows(IllegalArgumentException.class,
                () -> discovery.registerInternal(BuiltinComponent.class, BuiltinComponent::new));
    }

    @Test
    void getDescriptors_listsInternalBeforeExternal() throws Exception {
        writeDirectory(tempDir.resolve("core"), CORE_MANIFEST);
        ComponentDiscovery discovery = new ComponentDiscovery();
        discovery.scan(tempDir);
        discovery.registerInternal(BuiltinComponent.class, BuiltinComponent::new);

        List<ComponentDescriptor> all = discovery.getDescriptors();

        assertEquals("acme.builtin", all.get(0).getId());
        assertEquals("acme.core", all.get(1).getId());
    }
}
