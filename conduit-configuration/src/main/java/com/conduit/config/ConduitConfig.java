package com.conduit.config;

import com.conduit.annotations.IsolationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runtime configuration loaded from environment variables.
 * <p>
 * Components: CONDUIT_COMPONENTS_DIR, CONDUIT_COMPONENTS_REQUIRED. Isolation: CONDUIT_SHARED_PACKAGES,
 * CONDUIT_DEFAULT_ISOLATION. Lifecycle: CONDUIT_START_PARALLELISM, CONDUIT_RESOLUTION_POLICY.
 * Requests: CONDUIT_CHAIN_TIMEOUT_MS.
 */
public final class ConduitConfig {

    private static final Logger log = LoggerFactory.getLogger(ConduitConfig.class);

    private static final String ENV_COMPONENTS_DIR = "CONDUIT_COMPONENTS_DIR";
    private static final String ENV_COMPONENTS_REQUIRED = "CONDUIT_COMPONENTS_REQUIRED";
    private static final String ENV_SHARED_PACKAGES = "CONDUIT_SHARED_PACKAGES";
    private static final String ENV_DEFAULT_ISOLATION = "CONDUIT_DEFAULT_ISOLATION";
    private static final String ENV_CHAIN_TIMEOUT_MS = "CONDUIT_CHAIN_TIMEOUT_MS";
    private static final String ENV_START_PARALLELISM = "CONDUIT_START_PARALLELISM";
    private static final String ENV_RESOLUTION_POLICY = "CONDUIT_RESOLUTION_POLICY";

    private static final String DEFAULT_COMPONENTS_DIR = "components";
    private static final long DEFAULT_CHAIN_TIMEOUT_MS = 30_000L;
    private static final int DEFAULT_START_PARALLELISM = 1;

    private final Path componentsDir;
    private final boolean componentsRequired;
    private final List<String> sharedPackages;
    private final IsolationLevel defaultIsolation;
    private final Duration chainTimeout;
    private final int startParallelism;
    private final ResolutionFailurePolicy resolutionPolicy;

    private ConduitConfig(Builder b) {
        this.componentsDir = b.componentsDir;
        this.componentsRequired = b.componentsRequired;
        this.sharedPackages = Collections.unmodifiableList(new ArrayList<>(b.sharedPackages));
        this.defaultIsolation = b.defaultIsolation;
        this.chainTimeout = b.chainTimeout;
        this.startParallelism = b.startParallelism;
        this.resolutionPolicy = b.resolutionPolicy;
    }

    /** Directory scanned for component JARs and exploded directories. Default {@code components}. */
    public Path getComponentsDir() {
        return componentsDir;
    }

    /** When true, an unreadable component in the components directory fails bootstrap. Default false (log and skip). */
    public boolean isComponentsRequired() {
        return componentsRequired;
    }

    /** Module names added to the shared core (always loaded from the host). */
    public List<String> getSharedPackages() {
        return sharedPackages;
    }

    /** Isolation level for manifests that declare none. Default STANDARD. */
    public IsolationLevel getDefaultIsolation() {
        return defaultIsolation;
    }

    /** Per-request deadline; {@link Duration#ZERO} means no deadline. Default 30 s. */
    public Duration getChainTimeout() {
        return chainTimeout;
    }

    public boolean hasChainTimeout() {
        return !chainTimeout.isZero();
    }

    /** Threads used to start independent components concurrently. 1 = sequential. */
    public int getStartParallelism() {
        return startParallelism;
    }

    public ResolutionFailurePolicy getResolutionPolicy() {
        return resolutionPolicy;
    }

    public static ConduitConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Configuration from the given variables (same names as the process environment). */
    public static ConduitConfig fromEnvironment(Map<String, String> env) {
        return builder()
                .componentsDir(Path.of(getEnv(env, ENV_COMPONENTS_DIR, DEFAULT_COMPONENTS_DIR)))
                .componentsRequired(parseBoolean(env.get(ENV_COMPONENTS_REQUIRED), false))
                .sharedPackages(parseCommaSeparated(env.get(ENV_SHARED_PACKAGES)))
                .defaultIsolation(parseEnum(IsolationLevel.class, ENV_DEFAULT_ISOLATION,
                        env.get(ENV_DEFAULT_ISOLATION), IsolationLevel.STANDARD))
                .chainTimeout(Duration.ofMillis(Math.max(0L,
                        parseLong(env.get(ENV_CHAIN_TIMEOUT_MS), DEFAULT_CHAIN_TIMEOUT_MS))))
                .startParallelism(Math.max(1, parseInt(env.get(ENV_START_PARALLELISM), DEFAULT_START_PARALLELISM)))
                .resolutionPolicy(parseEnum(ResolutionFailurePolicy.class, ENV_RESOLUTION_POLICY,
                        env.get(ENV_RESOLUTION_POLICY), ResolutionFailurePolicy.ABORT_ALL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value, E defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid {}={}; using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private Path componentsDir = Path.of(DEFAULT_COMPONENTS_DIR);
        private boolean componentsRequired;
        private List<String> sharedPackages = List.of();
        private IsolationLevel defaultIsolation = IsolationLevel.STANDARD;
        private Duration chainTimeout = Duration.ofMillis(DEFAULT_CHAIN_TIMEOUT_MS);
        private int startParallelism = DEFAULT_START_PARALLELISM;
        private ResolutionFailurePolicy resolutionPolicy = ResolutionFailurePolicy.ABORT_ALL;

        public Builder componentsDir(Path componentsDir) {
            this.componentsDir = componentsDir;
            return this;
        }

        public Builder componentsRequired(boolean componentsRequired) {
            this.componentsRequired = componentsRequired;
            return this;
        }

        public Builder sharedPackages(List<String> sharedPackages) {
            this.sharedPackages = Objects.requireNonNull(sharedPackages, "sharedPackages");
            return this;
        }

        public Builder defaultIsolation(IsolationLevel defaultIsolation) {
            this.defaultIsolation = Objects.requireNonNull(defaultIsolation, "defaultIsolation");
            return this;
        }

        public Builder chainTimeout(Duration chainTimeout) {
            Objects.requireNonNull(chainTimeout, "chainTimeout");
            if (chainTimeout.isNegative()) {
                throw new IllegalArgumentException("chainTimeout must not be negative");
            }
            this.chainTimeout = chainTimeout;
            return this;
        }

        public Builder startParallelism(int startParallelism) {
            if (startParallelism < 1) {
                throw new IllegalArgumentException("startParallelism must be >= 1");
            }
            this.startParallelism = startParallelism;
            return this;
        }

        public Builder resolutionPolicy(ResolutionFailurePolicy resolutionPolicy) {
            this.resolutionPolicy = Objects.requireNonNull(resolutionPolicy, "resolutionPolicy");
            return this;
        }

        public ConduitConfig build() {
            return new ConduitConfig(this);
        }
    }
}
