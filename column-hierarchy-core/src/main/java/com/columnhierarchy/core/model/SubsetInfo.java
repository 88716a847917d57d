package com.columnhierarchy.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of one resolved node of the subset forest.
 *
 * @param id node identifier, assigned in discovery order
 * @param fullFields the node's complete field set
 * @param ownFields fields left after removing the parent's fields
 * @param parentId parent node id, or null for a root
 */
public record SubsetInfo(
    int id,
    Set<String> fullFields,
    Set<String> ownFields,
    Integer parentId
) {
    /**
     * Compact constructor with validation.
     */
    public SubsetInfo {
        Objects.requireNonNull(fullFields, "fullFields must not be null");
        Objects.requireNonNull(ownFields, "ownFields must not be null");
        fullFields = Collections.unmodifiableSet(new LinkedHashSet<>(fullFields));
        ownFields = Collections.unmodifiableSet(new LinkedHashSet<>(ownFields));
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
