package com.columnhierarchy.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one batch of column sets.
 *
 * @param mode resolution strategy that produced this result
 * @param columnSets input column sets, in input order
 * @param subsets resolved forest nodes in ascending size order (unanchored mode only)
 * @param types synthesized types, parents before children
 */
public record HierarchyResult(
    ResolutionMode mode,
    List<ColumnSet> columnSets,
    List<SubsetInfo> subsets,
    List<TypeDescriptor> types
) {
    /**
     * Compact constructor with validation.
     */
    public HierarchyResult {
        Objects.requireNonNull(mode, "mode must not be null");
        columnSets = columnSets == null ? List.of() : List.copyOf(columnSets);
        subsets = subsets == null ? List.of() : List.copyOf(subsets);
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * Looks up a synthesized type by name.
     *
     * @param name type name
     * @return the type, if present
     */
    public Optional<TypeDescriptor> findType(String name) {
        return types.stream()
            .filter(t -> t.name().equals(name))
            .findFirst();
    }

    /**
     * Returns only the root types.
     *
     * @return types without a concrete parent
     */
    public List<TypeDescriptor> rootTypes() {
        return types.stream()
            .filter(TypeDescriptor::isRoot)
            .toList();
    }
}
