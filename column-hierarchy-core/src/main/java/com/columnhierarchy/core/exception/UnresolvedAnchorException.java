package com.columnhierarchy.core.exception;

/**
 * Raised in anchored mode when a column set matches no registry type, no capability
 * marker is available as a fallback, and the run is configured to fail in that case.
 */
public class UnresolvedAnchorException extends IllegalStateException {

    public UnresolvedAnchorException(String message) {
        super(message);
    }
}
