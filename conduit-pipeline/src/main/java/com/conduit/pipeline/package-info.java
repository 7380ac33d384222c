/**
 * Behavior chain engine: composes the behaviors contributed by running components into one ordered,
 * cancellable, timeout-bounded request pipeline.
 * <ul>
 *   <li>{@link com.conduit.pipeline.Behavior} / {@link com.conduit.pipeline.Next} – one step and its continuation</li>
 *   <li>{@link com.conduit.pipeline.BehaviorContribution} – behavior plus priority, constraint, tags, enabled flag, error handler</li>
 *   <li>{@link com.conduit.pipeline.BehaviorChain} – immutable chain with an index-based dispatcher; timeout, retry, error-handling and conditional wrappers</li>
 *   <li>{@link com.conduit.pipeline.ActiveChain} – atomically swapped chain snapshot, contributions grouped per component</li>
 *   <li>{@link com.conduit.pipeline.PipelineContext} – request-scoped message, result, cancellation, deadline and properties</li>
 *   <li>{@link com.conduit.pipeline.ChainWatchdog} – single deadline watchdog that cancels timed-out executions</li>
 * </ul>
 */
package com.conduit.pipeline;
