package com.conduit.lifecycle;

import com.conduit.component.ComponentState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a lifecycle operation: the state each affected component ended in, the order the operation
 * processed them, and the errors it recorded.
 */
public final class LifecycleReport {

    private final Map<String, ComponentState> outcomes;
    private final List<String> order;
    private final List<ComponentError> errors;

    LifecycleReport(Map<String, ComponentState> outcomes, List<String> order, List<ComponentError> errors) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.order = List.copyOf(order);
        this.errors = List.copyOf(errors);
    }

    /** Final state per component, in processing order. */
    public Map<String, ComponentState> getOutcomes() {
        return outcomes;
    }

    public ComponentState getOutcome(String componentId) {
        return outcomes.get(componentId);
    }

    /** Order the components were processed in (start order for a start, stop order for a stop). */
    public List<String> getOrder() {
        return order;
    }

    public List<ComponentError> getErrors() {
        return errors;
    }

    public List<ComponentError> getErrors(String componentId) {
        Objects.requireNonNull(componentId, "componentId");
        return errors.stream().filter(e -> componentId.equals(e.getComponentId())).collect(Collectors.toList());
    }

    /** Ids in the given state. */
    public List<String> inState(ComponentState state) {
        List<String> out = new ArrayList<>();
        outcomes.forEach((id, s) -> {
            if (s == state) out.add(id);
        });
        return out;
    }

    public List<String> getFailed() {
        return inState(ComponentState.FAILED);
    }

    /** True when no component failed and no error of severity ERROR or above was recorded. */
    public boolean isSuccess() {
        return getFailed().isEmpty()
                && errors.stream().noneMatch(e -> e.getSeverity().isAtLeast(ErrorSeverity.ERROR));
    }

    @Override
    public String toString() {
        return "LifecycleReport{outcomes=" + outcomes + ", errors=" + errors.size() + "}";
    }
}
