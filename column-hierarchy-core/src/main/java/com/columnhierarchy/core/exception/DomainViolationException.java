package com.columnhierarchy.core.exception;

/**
 * Raised when a forest invariant would be broken, such as giving a node a second parent.
 *
 * <p>The resolver's own construction order never triggers this; seeing it means a bug.
 */
public class DomainViolationException extends IllegalStateException {

    public DomainViolationException(String message) {
        super(message);
    }
}
