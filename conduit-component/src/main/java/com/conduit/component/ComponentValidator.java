package com.conduit.component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks on a descriptor before it takes part in resolution.
 * <p>
 * {@link #validate} accepts any non-blank id. The lowercase id convention is enforced only on manifests read
 * from the components directory ({@link #validateManifest}).
 */
public final class ComponentValidator {

    /** Lowercase segments of letters, digits and dashes separated by dots, e.g. {@code acme.audit-log}. */
    public static final Pattern ID_PATTERN = Pattern.compile("^[a-z][a-z0-9-]*(\\.[a-z][a-z0-9-]*)*$");
    /** MAJOR.MINOR.PATCH with an optional qualifier, e.g. {@code 2.1.0-beta}. */
    public static final Pattern VERSION_PATTERN = Pattern.compile("^\\d+\\.\\d+\\.\\d+(-[a-zA-Z0-9-]+)?$");

    private ComponentValidator() {
    }

    /**
     * @return problems found; empty if the descriptor is valid
     */
    public static List<String> validate(ComponentDescriptor descriptor) {
        List<String> problems = new ArrayList<>();
        if (descriptor.getId().isBlank()) {
            problems.add("id must be non-blank");
        }
        if (descriptor.getName().isBlank()) {
            problems.add("name must be non-blank");
        }
        if (!VERSION_PATTERN.matcher(descriptor.getVersion()).matches()) {
            problems.add("invalid version '" + descriptor.getVersion() + "' (expected MAJOR.MINOR.PATCH[-qualifier])");
        }
        if (descriptor.dependsOn(descriptor.getId())) {
            problems.add("component depends on itself");
        }
        if (descriptor.getLocation() != null && (descriptor.getEntryPoint() == null || descriptor.getEntryPoint().isBlank())) {
            problems.add("entry point is required when a location is set");
        }
        return problems;
    }

    /**
     * {@link #validate} plus the {@link #ID_PATTERN} convention for ids of external components.
     */
    public static List<String> validateManifest(ComponentDescriptor descriptor) {
        List<String> problems = new ArrayList<>();
        if (!descriptor.getId().isBlank() && !ID_PATTERN.matcher(descriptor.getId()).matches()) {
            problems.add("invalid id '" + descriptor.getId() + "' (expected lowercase dot-separated segments)");
        }
        problems.addAll(validate(descriptor));
        return problems;
    }

    public static boolean isValid(ComponentDescriptor descriptor) {
        return validate(descriptor).isEmpty();
    }
}
