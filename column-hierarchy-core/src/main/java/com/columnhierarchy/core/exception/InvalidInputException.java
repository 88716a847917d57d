package com.columnhierarchy.core.exception;

/**
 * Raised when the input to a resolution run is absent or malformed.
 *
 * <p>Thrown before any resolution work starts; no partial result exists.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
