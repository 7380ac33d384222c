package com.conduit.bootstrap;

import com.conduit.component.ComponentDescriptor;
import com.conduit.component.discovery.ComponentDiscovery;
import com.conduit.component.isolation.IsolatedComponentLoader;
import com.conduit.component.isolation.SharedCore;
import com.conduit.config.ConduitConfig;
import com.conduit.lifecycle.ComponentLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Bootstrap for the runtime: loads configuration, registers compiled-in components, scans the components
 * directory and wires the lifecycle manager. Returns a {@link ConduitRuntime} that is not started yet.
 */
public final class ConduitBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ConduitBootstrap.class);

    private ConduitBootstrap() {
    }

    /**
     * Configuration from the environment, no compiled-in components.
     */
    public static ConduitRuntime initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(ConduitConfig.fromEnvironment(), discovery -> { });
    }

    /**
     * @param internalComponents registers compiled-in components on the discovery (internal components come
     *                           first and a failure to register them is fatal)
     */
    public static ConduitRuntime initialize(ConduitConfig config, Consumer<ComponentDiscovery> internalComponents) {
        return initialize(config, internalComponents, Map.of());
    }

    /**
     * @param properties handed to every component in its context
     */
    public static ConduitRuntime initialize(ConduitConfig config, Consumer<ComponentDiscovery> internalComponents,
                                            Map<String, String> properties) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(internalComponents, "internalComponents");
        log.info("Bootstrap: componentsDir={}, defaultIsolation={}, sharedPackages={}, resolutionPolicy={}, "
                        + "startParallelism={}, chainTimeoutMs={}",
                config.getComponentsDir().toAbsolutePath(), config.getDefaultIsolation(), config.getSharedPackages(),
                config.getResolutionPolicy(), config.getStartParallelism(), config.getChainTimeout().toMillis());

        ComponentDiscovery discovery = new ComponentDiscovery(config.getDefaultIsolation(), config.isComponentsRequired());
        internalComponents.accept(discovery);
        discovery.scan(config.getComponentsDir());
        List<ComponentDescriptor> descriptors = discovery.getDescriptors();
        if (descriptors.isEmpty()) {
            log.warn("No components found; check compiled-in registrations and CONDUIT_COMPONENTS_DIR");
        } else {
            log.info("Bootstrap: {} internal and {} external component(s)",
                    discovery.getInternalDescriptors().size(), discovery.getExternalDescriptors().size());
        }

        ComponentLifecycleManager manager = ComponentLifecycleManager.builder()
                .loader(discovery.getInternalLoader())
                .loader(new IsolatedComponentLoader())
                .sharedCore(SharedCore.withExtras(config.getSharedPackages()))
                .resolutionPolicy(config.getResolutionPolicy())
                .startParallelism(config.getStartParallelism())
                .properties(properties)
                .build();
        return new ConduitRuntime(config, descriptors, manager);
    }
}
