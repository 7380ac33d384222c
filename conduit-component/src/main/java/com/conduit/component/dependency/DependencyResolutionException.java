package com.conduit.component.dependency;

/**
 * Base type for failures computing a start order.
 */
public class DependencyResolutionException extends RuntimeException {

    public DependencyResolutionException(String message) {
        super(message);
    }
}
