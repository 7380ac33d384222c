package com.conduit.component.discovery;

import com.conduit.annotations.IsolationLevel;
import com.conduit.component.ComponentDescriptor;
import com.conduit.component.ComponentValidator;
import com.conduit.component.PluggableComponent;
import com.conduit.component.isolation.ComponentLoadException;
import com.conduit.component.isolation.RegisteredComponentLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Finds components: compiled-in ones registered explicitly with {@link #registerInternal}, and external ones
 * in the components directory. Only that directory is scanned (not recursively): each {@code *.jar} and each
 * sub-directory carrying {@value ComponentManifest#RESOURCE} is one component.
 * <p>
 * An unreadable or invalid external component is logged and skipped unless discovery is {@code required},
 * in which case it fails with {@link ComponentLoadException}. Internal registration failures always throw.
 */
public final class ComponentDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ComponentDiscovery.class);

    private final IsolationLevel defaultIsolation;
    private final boolean required;
    private final RegisteredComponentLoader internalLoader = new RegisteredComponentLoader();
    private final List<ComponentDescriptor> internal = new ArrayList<>();
    private final List<ComponentDescriptor> external = new ArrayList<>();

    public ComponentDiscovery() {
        this(IsolationLevel.STANDARD, false);
    }

    /**
     * @param defaultIsolation isolation level for manifests that declare none
     * @param required         whether a failing external component fails discovery
     */
    public ComponentDiscovery(IsolationLevel defaultIsolation, boolean required) {
        this.defaultIsolation = Objects.requireNonNull(defaultIsolation, "defaultIsolation");
        this.required = required;
    }

    /**
     * Registers a compiled-in component. Its descriptor comes from the {@code @ConduitComponent} annotation on
     * {@code type}; {@code factory} creates a new instance on every (re)load.
     *
     * @return the descriptor
     */
    public synchronized <T extends PluggableComponent> ComponentDescriptor registerInternal(Class<T> type, Supplier<T> factory) {
        return registerInternal(ComponentDescriptor.fromAnnotation(type), factory);
    }

    /**
     * Registers a compiled-in component with an explicit descriptor.
     *
     * @throws IllegalArgumentException if a component with the same id was already registered
     */
    public synchronized ComponentDescriptor registerInternal(ComponentDescriptor descriptor,
                                                              Supplier<? extends PluggableComponent> factory) {
        Objects.requireNonNull(descriptor, "descriptor");
        internalLoader.register(descriptor.getId(), factory);
        internal.add(descriptor);
        log.debug("Registered internal component {}", descriptor.getId());
        return descriptor;
    }

    /**
     * Scans {@code componentsDir}. A missing directory is not an error.
     *
     * @return descriptors discovered by this scan
     * @throws ComponentLoadException if {@code required} and a component cannot be read
     */
    public synchronized List<ComponentDescriptor> scan(Path componentsDir) {
        List<ComponentDescriptor> found = new ArrayList<>();
        if (componentsDir == null) {
            return found;
        }
        if (!Files.exists(componentsDir)) {
            log.debug("Components directory does not exist: {}", componentsDir);
            return found;
        }
        if (!Files.isDirectory(componentsDir)) {
            log.warn("Components path is not a directory: {}", componentsDir);
            return found;
        }
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(componentsDir)) {
            for (Path p : stream) {
                if (Files.isDirectory(p) || p.getFileName().toString().endsWith(".jar")) {
                    candidates.add(p);
                }
            }
        } catch (IOException e) {
            if (required) {
                throw new ComponentLoadException(null, "Failed to list components directory " + componentsDir, e);
            }
            log.warn("Failed to list components directory {}: {}", componentsDir, e.getMessage());
            return found;
        }
        candidates.sort(null);
        for (Path candidate : candidates) {
            ComponentDescriptor d = readCandidate(candidate);
            if (d != null) found.add(d);
        }
        external.addAll(found);
        log.info("Discovered {} component(s) in {}", found.size(), componentsDir);
        return found;
    }

    private ComponentDescriptor readCandidate(Path candidate) {
        try {
            ComponentManifest manifest = Files.isDirectory(candidate) ? readDirectory(candidate) : readJar(candidate);
            if (manifest == null) {
                log.debug("Skipping {}: no {}", candidate.getFileName(), ComponentManifest.RESOURCE);
                return null;
            }
            if (manifest.getEntryPoint() == null || manifest.getEntryPoint().isEmpty()) {
                throw new IOException("Manifest of " + manifest.getId() + " has no entryPoint");
            }
            ComponentDescriptor d = manifest.toDescriptor(candidate, defaultIsolation);
            List<String> problems = ComponentValidator.validateManifest(d);
            if (!problems.isEmpty()) {
                throw new IOException("Invalid manifest of " + d.getId() + ": " + String.join("; ", problems));
            }
            log.debug("Found component {} {} at {}", d.getId(), d.getVersion(), candidate);
            return d;
        } catch (IOException | RuntimeException e) {
            if (required) {
                throw new ComponentLoadException(null, "Failed to read component " + candidate + ": " + e.getMessage(), e);
            }
            log.error("Failed to read component {} (skipping): {}", candidate, e.getMessage(), e);
            return null;
        }
    }

    static ComponentManifest readDirectory(Path dir) throws IOException {
        Path manifest = dir.resolve(ComponentManifest.RESOURCE);
        if (!Files.isRegularFile(manifest)) return null;
        try (InputStream in = Files.newInputStream(manifest)) {
            return ComponentManifest.read(in);
        }
    }

    static ComponentManifest readJar(Path jar) throws IOException {
        try (JarFile file = new JarFile(jar.toFile())) {
            JarEntry entry = file.getJarEntry(ComponentManifest.RESOURCE);
            if (entry == null) return null;
            try (InputStream in = file.getInputStream(entry)) {
                return ComponentManifest.read(in);
            }
        }
    }

    /** Loader holding the factories of internal components. */
    public RegisteredComponentLoader getInternalLoader() {
        return internalLoader;
    }

    public synchronized List<ComponentDescriptor> getInternalDescriptors() {
        return List.copyOf(internal);
    }

    public synchronized List<ComponentDescriptor> getExternalDescriptors() {
        return List.copyOf(external);
    }

    /** Internal descriptors first, then external ones in scan order. */
    public synchronized List<ComponentDescriptor> getDescriptors() {
        List<ComponentDescriptor> out = new ArrayList<>(internal.size() + external.size());
        out.addAll(internal);
        out.addAll(external);
        return out;
    }
}
