package com.conduit.annotations;

/**
 * Contract for releasing resources when a component is unloaded or the runtime shuts down.
 * Components holding connections, threads or caches implement this and release them in {@link #onExit()}.
 * The lifecycle manager calls {@code onExit()} after {@code onDetach()} when a component is unloaded
 * (hot reload, shutdown).
 */
public interface ResourceCleanup {

    /**
     * Called once per unload. Exceptions are logged by the caller and do not stop other components
     * from being cleaned up.
     */
    void onExit();
}
