package com.columnhierarchy.core.model;

import com.columnhierarchy.core.exception.InvalidInputException;

import java.util.Locale;

/**
 * Strategy used to place column sets into a type hierarchy.
 */
public enum ResolutionMode {
    /** Discover recurring subsets from the input and chain them into a fresh forest */
    UNANCHORED,

    /** Match each column set against a registry of existing base types */
    ANCHORED;

    /**
     * Parses a mode name, ignoring case and surrounding whitespace.
     *
     * @param value mode name
     * @return resolution mode, {@link #UNANCHORED} when the value is null or blank
     * @throws InvalidInputException if the value names no mode
     */
    public static ResolutionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return UNANCHORED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown resolution mode: " + value, e);
        }
    }
}
