package com.conduit.component.isolation;

import com.conduit.annotations.IsolationLevel;
import com.conduit.component.ComponentDescriptor;
import com.conduit.component.IsolationRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * Loading boundary of one component instance: its private location and the modules found there, its
 * allowed and blocked modules, and the process-wide shared core. Owns the component's class loader, if one
 * was opened; {@link #close()} releases it. A new boundary is created for every load (a hot reload never
 * reuses the previous one).
 */
public final class LoadBoundary implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LoadBoundary.class);

    private static final String CLASS_SUFFIX = ".class";

    private final String componentId;
    private final IsolationLevel level;
    private final Set<String> allowedModules;
    private final Set<String> blockedModules;
    private final SharedCore sharedCore;
    private final Path location;
    private final Set<String> privateModules;
    private final Set<String> privatePackages;
    private ComponentClassLoader classLoader;
    private boolean closed;

    private LoadBoundary(String componentId, IsolationRequirements requirements, SharedCore sharedCore,
                         Path location, Collection<String> privateModules) {
        this.componentId = Objects.requireNonNull(componentId, "componentId");
        this.level = requirements.getLevel();
        this.allowedModules = requirements.getAllowedModules();
        this.blockedModules = requirements.getBlockedModules();
        this.sharedCore = Objects.requireNonNull(sharedCore, "sharedCore");
        this.location = location;
        Set<String> modules = new TreeSet<>();
        Set<String> packages = new TreeSet<>();
        for (String m : privateModules) {
            modules.add(m);
            String pkg = ModuleNames.packageOf(m);
            if (!pkg.isEmpty()) packages.add(pkg);
        }
        modules.addAll(packages);
        this.privateModules = Collections.unmodifiableSet(modules);
        this.privatePackages = Collections.unmodifiableSet(packages);
    }

    /**
     * Boundary for a descriptor; indexes the classes found at the descriptor's location, if any.
     *
     * @throws ComponentLoadException if the location cannot be read
     */
    public static LoadBoundary create(ComponentDescriptor descriptor, SharedCore sharedCore) {
        Path location = descriptor.getLocation();
        Set<String> modules;
        try {
            modules = location != null ? indexClasses(location) : Set.of();
        } catch (IOException e) {
            throw new ComponentLoadException(descriptor.getId(),
                    "Cannot read location " + location + " of component " + descriptor.getId() + ": " + e.getMessage(), e);
        }
        log.debug("Boundary for component {}: level={}, location={}, {} private class(es)",
                descriptor.getId(), descriptor.getIsolation().getLevel(), location, modules.size());
        return new LoadBoundary(descriptor.getId(), descriptor.getIsolation(), sharedCore, location, modules);
    }

    /** Boundary with an explicit set of private class names (no location scan). */
    public static LoadBoundary of(String componentId, IsolationRequirements requirements, SharedCore sharedCore,
                                  Collection<String> privateClassNames) {
        return new LoadBoundary(componentId, requirements, sharedCore, null,
                privateClassNames != null ? privateClassNames : Set.of());
    }

    public String getComponentId() {
        return componentId;
    }

    public IsolationLevel getLevel() {
        return level;
    }

    public Set<String> getAllowedModules() {
        return allowedModules;
    }

    public Set<String> getBlockedModules() {
        return blockedModules;
    }

    public SharedCore getSharedCore() {
        return sharedCore;
    }

    /** Private location; null for components without one. */
    public Path getLocation() {
        return location;
    }

    /**
     * Whether {@code moduleName} (class or package) is found in the private location: an indexed class,
     * an indexed package, or a prefix of one.
     */
    public boolean providesPrivately(String moduleName) {
        if (privateModules.contains(moduleName)) return true;
        for (String pkg : privatePackages) {
            if (ModuleNames.covers(moduleName, pkg)) return true;
        }
        return false;
    }

    public ModuleSource resolve(String moduleName) {
        return IsolationPolicy.resolve(this, moduleName);
    }

    /**
     * Resolves {@code moduleName} and fails if it is rejected.
     *
     * @throws RestrictedModuleException if the boundary rejects the module
     */
    public ModuleSource check(String moduleName) {
        ModuleSource source = resolve(moduleName);
        if (source == ModuleSource.REJECTED) {
            throw new RestrictedModuleException(componentId, moduleName);
        }
        return source;
    }

    /**
     * Class loader for the component's private location, created on first call.
     *
     * @param host loader of the host (shared core and fallback)
     * @throws IllegalStateException if the boundary is closed or has no location
     */
    public synchronized ComponentClassLoader openClassLoader(ClassLoader host) {
        if (closed) {
            throw new IllegalStateException("Boundary of component " + componentId + " is closed");
        }
        if (location == null) {
            throw new IllegalStateException("Component " + componentId + " has no private location");
        }
        if (classLoader == null) {
            URL url;
            try {
                url = location.toUri().toURL();
            } catch (MalformedURLException e) {
                throw new ComponentLoadException(componentId, "Invalid location " + location, e);
            }
            classLoader = new ComponentClassLoader(this, new URL[]{url}, host);
        }
        return classLoader;
    }

    /** Class loader opened for this boundary, or null. */
    public synchronized ComponentClassLoader getClassLoader() {
        return classLoader;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Releases the class loader, if any. Idempotent. */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (classLoader != null) {
            try {
                classLoader.close();
                log.debug("Closed class loader of component {}", componentId);
            } catch (IOException e) {
                log.warn("Failed to close class loader of component {}: {}", componentId, e.getMessage());
            }
            classLoader = null;
        }
    }

    static Set<String> indexClasses(Path location) throws IOException {
        Set<String> classes = new TreeSet<>();
        if (Files.isDirectory(location)) {
            try (Stream<Path> files = Files.walk(location)) {
                files.filter(Files::isRegularFile).forEach(f -> {
                    String rel = location.relativize(f).toString().replace(f.getFileSystem().getSeparator(), "/");
                    addClass(classes, rel);
                });
            }
        } else if (Files.isRegularFile(location)) {
            try (JarFile jar = new JarFile(location.toFile())) {
                Enumeration<JarEntry> entries = jar.entries();
                while (entries.hasMoreElements()) {
                    JarEntry e = entries.nextElement();
                    if (!e.isDirectory()) addClass(classes, e.getName());
                }
            }
        } else {
            throw new IOException("No such file or directory: " + location);
        }
        return classes;
    }

    private static void addClass(Set<String> classes, String entryName) {
        if (!entryName.endsWith(CLASS_SUFFIX) || entryName.startsWith("META-INF/")) return;
        String name = entryName.substring(0, entryName.length() - CLASS_SUFFIX.length()).replace('/', '.');
        if (name.equals("module-info") || name.endsWith("package-info")) return;
        classes.add(name);
    }

    @Override
    public String toString() {
        return "LoadBoundary{" + componentId + ", " + level + ", location=" + location + "}";
    }
}
