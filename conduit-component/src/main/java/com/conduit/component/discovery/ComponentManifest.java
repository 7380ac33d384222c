package com.conduit.component.discovery;

import com.conduit.annotations.IsolationLevel;
import com.conduit.component.ComponentDescriptor;
import com.conduit.component.IsolationRequirements;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Component manifest, read from {@value #RESOURCE} inside a component JAR or exploded directory.
 * <pre>
 * {
 *   "id": "acme.audit",
 *   "name": "Audit log",
 *   "version": "1.2.0",
 *   "entryPoint": "com.acme.audit.AuditComponent",
 *   "dependencies": ["acme.core"],
 *   "isolation": { "level": "STANDARD", "allowedModules": [], "blockedModules": ["com.acme.internal"] },
 *   "requiredModules": ["com.acme.audit.store"]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ComponentManifest {

    /** Manifest location inside a component JAR or directory. */
    public static final String RESOURCE = "META-INF/conduit-component.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final String entryPoint;
    private final List<String> dependencies;
    private final Isolation isolation;
    private final List<String> requiredModules;

    @JsonCreator
    public ComponentManifest(@JsonProperty("id") String id,
                             @JsonProperty("name") String name,
                             @JsonProperty("version") String version,
                             @JsonProperty("description") String description,
                             @JsonProperty("entryPoint") String entryPoint,
                             @JsonProperty("dependencies") List<String> dependencies,
                             @JsonProperty("isolation") Isolation isolation,
                             @JsonProperty("requiredModules") List<String> requiredModules) {
        this.id = id != null ? id.trim() : "";
        this.name = name;
        this.version = version != null ? version.trim() : "";
        this.description = description;
        this.entryPoint = entryPoint != null ? entryPoint.trim() : null;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.isolation = isolation;
        this.requiredModules = requiredModules != null ? List.copyOf(requiredModules) : List.of();
    }

    /**
     * @throws IOException if the stream is not a valid manifest
     */
    public static ComponentManifest read(InputStream in) throws IOException {
        ComponentManifest manifest = MAPPER.readValue(in, ComponentManifest.class);
        if (manifest == null || manifest.id.isEmpty()) {
            throw new IOException("Manifest has no id");
        }
        return manifest;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    /** Isolation section; null if the manifest has none. */
    public Isolation getIsolation() {
        return isolation;
    }

    public List<String> getRequiredModules() {
        return requiredModules;
    }

    /**
     * Descriptor for this manifest.
     *
     * @param location     JAR or directory the manifest was read from
     * @param defaultLevel isolation level when the manifest declares none
     */
    public ComponentDescriptor toDescriptor(Path location, IsolationLevel defaultLevel) {
        IsolationLevel level = isolation != null && isolation.getLevel() != null ? isolation.getLevel() : defaultLevel;
        ComponentDescriptor.Builder b = ComponentDescriptor.builder(id)
                .name(name)
                .description(description)
                .dependencies(dependencies)
                .isolation(IsolationRequirements.of(level,
                        isolation != null ? isolation.getAllowedModules() : List.of(),
                        isolation != null ? isolation.getBlockedModules() : List.of()))
                .requiredModules(requiredModules)
                .entryPoint(entryPoint)
                .location(location);
        if (!version.isEmpty()) b.version(version);
        return b.build();
    }

    /**
     * Isolation section of the manifest.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Isolation {
        private final IsolationLevel level;
        private final List<String> allowedModules;
        private final List<String> blockedModules;

        @JsonCreator
        public Isolation(@JsonProperty("level") IsolationLevel level,
                         @JsonProperty("allowedModules") List<String> allowedModules,
                         @JsonProperty("blockedModules") List<String> blockedModules) {
            this.level = level;
            this.allowedModules = allowedModules != null ? List.copyOf(allowedModules) : List.of();
            this.blockedModules = blockedModules != null ? List.copyOf(blockedModules) : List.of();
        }

        public IsolationLevel getLevel() {
            return level;
        }

        public List<String> getAllowedModules() {
            return allowedModules;
        }

        public List<String> getBlockedModules() {
            return blockedModules;
        }
    }
}
