package com.conduit.config;

/**
 * What a start does when dependency resolution fails for part of the batch (unknown dependency or cycle).
 */
public enum ResolutionFailurePolicy {
    /** Nothing in the batch starts: offending components fail, the others stay registered. */
    ABORT_ALL,
    /** Offending components and everything depending on them fail; the rest resolves and starts. */
    FAIL_DEPENDENTS
}
