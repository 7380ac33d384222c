/**
 * Conduit annotations: component metadata shared by components and the runtime.
 * <ul>
 *   <li>{@link com.conduit.annotations.ConduitComponent} – component id, version, dependencies and isolation requirements</li>
 *   <li>{@link com.conduit.annotations.IsolationLevel} – NONE, STANDARD or STRICT load boundary</li>
 *   <li>{@link com.conduit.annotations.ResourceCleanup} – release resources on unload</li>
 * </ul>
 */
package com.conduit.annotations;
