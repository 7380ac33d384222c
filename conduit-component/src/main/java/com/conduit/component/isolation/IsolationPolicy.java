package com.conduit.component.isolation;

import com.conduit.annotations.IsolationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides where a module referenced by a component comes from. Rules, first match wins:
 * <ol>
 *   <li>shared core → {@link ModuleSource#SHARED_CORE}, whatever the level</li>
 *   <li>level NONE → SHARED_CORE</li>
 *   <li>blocked → {@link ModuleSource#REJECTED}</li>
 *   <li>allow-list present and module not on it → REJECTED</li>
 *   <li>level STANDARD and the module is in the component's private location → {@link ModuleSource#PRIVATE}</li>
 *   <li>otherwise → SHARED_CORE</li>
 * </ol>
 * The block-list is checked before the allow-list, so a module on both is rejected.
 */
public final class IsolationPolicy {

    private static final Logger log = LoggerFactory.getLogger(IsolationPolicy.class);

    private IsolationPolicy() {
    }

    public static ModuleSource resolve(LoadBoundary boundary, String moduleName) {
        ModuleSource source = classify(boundary, moduleName);
        if (log.isTraceEnabled()) {
            log.trace("Component {}: module {} -> {}", boundary.getComponentId(), moduleName, source);
        }
        return source;
    }

    private static ModuleSource classify(LoadBoundary boundary, String moduleName) {
        if (boundary.getSharedCore().contains(moduleName)) {
            return ModuleSource.SHARED_CORE;
        }
        IsolationLevel level = boundary.getLevel();
        if (level == IsolationLevel.NONE) {
            return ModuleSource.SHARED_CORE;
        }
        if (ModuleNames.coveredByAny(boundary.getBlockedModules(), moduleName)) {
            return ModuleSource.REJECTED;
        }
        if (!boundary.getAllowedModules().isEmpty()
                && !ModuleNames.coveredByAny(boundary.getAllowedModules(), moduleName)) {
            return ModuleSource.REJECTED;
        }
        if (level == IsolationLevel.STANDARD && boundary.providesPrivately(moduleName)) {
            return ModuleSource.PRIVATE;
        }
        return ModuleSource.SHARED_CORE;
    }
}
