package com.columnhierarchy.core.model;

import com.columnhierarchy.core.exception.InvalidInputException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered sequence of field names describing one record shape.
 *
 * <p>Field names are case-sensitive and are not normalized. Duplicate names are
 * tolerated; {@link #fieldSet()} collapses them, keeping the first occurrence's position.
 *
 * @param columns field names in input order
 */
public record ColumnSet(
    List<String> columns
) {
    /**
     * Compact constructor with validation.
     */
    public ColumnSet {
        if (columns == null) {
            throw new InvalidInputException("columns must not be null");
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i) == null) {
                throw new InvalidInputException("column name at index " + i + " must not be null");
            }
        }
        columns = List.copyOf(columns);
    }

    /**
     * Creates a column set from the given field names.
     *
     * @param columns field names
     * @return column set
     */
    public static ColumnSet of(String... columns) {
        return new ColumnSet(List.of(columns));
    }

    /**
     * Returns the distinct field names in first-occurrence order.
     *
     * @return unmodifiable ordered set of field names
     */
    public Set<String> fieldSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(columns));
    }

    /**
     * Returns the number of distinct field names.
     *
     * @return distinct field count
     */
    public int width() {
        return fieldSet().size();
    }

    @Override
    public String toString() {
        return String.join(",", columns);
    }
}
