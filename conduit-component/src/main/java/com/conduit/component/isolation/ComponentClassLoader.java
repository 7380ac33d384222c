package com.conduit.component.isolation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.net.URLClassLoader;

/**
 * Class loader of one component, enforcing its {@link LoadBoundary} on every class request:
 * <ul>
 *   <li>shared core: host only, never the component's copy</li>
 *   <li>{@link ModuleSource#REJECTED}: {@link ClassNotFoundException} ("Access denied"); reflection is no backdoor</li>
 *   <li>{@link ModuleSource#PRIVATE}: the component's location first, host as fallback (parent-last)</li>
 *   <li>otherwise: host first, the component's location as fallback</li>
 * </ul>
 * Closed (and its classes released once unreferenced) when the boundary is closed.
 */
public final class ComponentClassLoader extends URLClassLoader {

    private static final Logger log = LoggerFactory.getLogger(ComponentClassLoader.class);

    static {
        ClassLoader.registerAsParallelCapable();
    }

    private final LoadBoundary boundary;

    ComponentClassLoader(LoadBoundary boundary, URL[] urls, ClassLoader host) {
        super("component-" + boundary.getComponentId(), urls, host);
        this.boundary = boundary;
    }

    public String getComponentId() {
        return boundary.getComponentId();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                c = loadThroughBoundary(name);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    private Class<?> loadThroughBoundary(String name) throws ClassNotFoundException {
        if (boundary.getSharedCore().contains(name)) {
            return getParent().loadClass(name);
        }
        ModuleSource source = boundary.resolve(name);
        switch (source) {
            case REJECTED:
                log.warn("Component {} denied access to {}", boundary.getComponentId(), name);
                throw new ClassNotFoundException("Access denied: " + name
                        + " (restricted for component " + boundary.getComponentId() + ")");
            case PRIVATE:
                try {
                    return findClass(name);
                } catch (ClassNotFoundException e) {
                    return getParent().loadClass(name);
                }
            default:
                try {
                    return getParent().loadClass(name);
                } catch (ClassNotFoundException e) {
                    return findClass(name);
                }
        }
    }

    @Override
    public URL getResource(String name) {
        String asModule = name.endsWith(".class") ? name.substring(0, name.length() - 6).replace('/', '.') : null;
        if (asModule != null && boundary.resolve(asModule) == ModuleSource.PRIVATE) {
            URL own = findResource(name);
            if (own != null) return own;
        }
        return super.getResource(name);
    }
}
