package com.conduit.bootstrap;

import com.conduit.component.ComponentDescriptor;
import com.conduit.component.ComponentState;
import com.conduit.config.ConduitConfig;
import com.conduit.lifecycle.ComponentError;
import com.conduit.lifecycle.ComponentLifecycleManager;
import com.conduit.lifecycle.LifecycleReport;
import com.conduit.pipeline.BehaviorChain;
import com.conduit.pipeline.ChainWatchdog;
import com.conduit.pipeline.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Running runtime: lifecycle control over the discovered components and request processing against the
 * active chain. Each request runs on the chain snapshot current when it arrives, bounded by the configured
 * chain timeout.
 */
public final class ConduitRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConduitRuntime.class);

    private final ConduitConfig config;
    private final List<ComponentDescriptor> descriptors;
    private final ComponentLifecycleManager manager;
    private final ChainWatchdog watchdog = new ChainWatchdog("conduit-runtime-watchdog");
    private volatile boolean started;

    ConduitRuntime(ConduitConfig config, List<ComponentDescriptor> descriptors, ComponentLifecycleManager manager) {
        this.config = Objects.requireNonNull(config, "config");
        this.descriptors = List.copyOf(descriptors);
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    /** Starts every discovered component; see {@link ComponentLifecycleManager#startAll}. */
    public synchronized LifecycleReport start() {
        LifecycleReport report = manager.startAll(descriptors);
        started = true;
        if (!report.isSuccess()) {
            log.warn("Runtime started with failures: {}", report.getErrors());
        }
        return report;
    }

    public synchronized LifecycleReport stop() {
        started = false;
        return manager.stopAll();
    }

    public LifecycleReport hotReload(String componentId) {
        return manager.hotReload(componentId);
    }

    /**
     * Runs the active chain for one inbound message.
     *
     * @throws com.conduit.pipeline.PipelineTimeoutException   if the chain timeout passed first
     * @throws com.conduit.pipeline.PipelineExecutionException if a behavior failed with a checked exception
     */
    public Object process(Object message) {
        return process(new PipelineContext(message));
    }

    public Object process(PipelineContext context) {
        BehaviorChain chain = manager.getActiveChain().current();
        if (config.hasChainTimeout()) {
            chain = chain.withTimeout(config.getChainTimeout(), watchdog);
        }
        log.debug("Processing {} with chain {}", context.getContextId(), chain.behaviorIds());
        return chain.run(context);
    }

    public ComponentState getState(String componentId) {
        return manager.getState(componentId);
    }

    public List<ComponentError> getErrors() {
        return manager.getErrors();
    }

    public List<ComponentDescriptor> getDescriptors() {
        return descriptors;
    }

    public ComponentLifecycleManager getManager() {
        return manager;
    }

    public ConduitConfig getConfig() {
        return config;
    }

    public boolean isStarted() {
        return started;
    }

    /** Stops the components if started and releases the watchdog thread. */
    @Override
    public synchronized void close() {
        if (started) {
            stop();
        }
        watchdog.close();
    }
}
