package com.columnhierarchy.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A synthesized type, ready to be handed to an emitter.
 *
 * <p>A type either extends a concrete parent ({@code parentName}) or, when it is a root,
 * implements the capability marker ({@code marker}). Never both. A root without a marker
 * is possible only when no marker was configured.
 *
 * @param name type name
 * @param parentName concrete parent type name, or null for a root
 * @param marker capability marker implemented by a root, or null
 * @param ownFields fields declared on this type only
 */
public record TypeDescriptor(
    String name,
    String parentName,
    String marker,
    List<String> ownFields
) {
    /**
     * Compact constructor with validation.
     */
    public TypeDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.equals(parentName)) {
            throw new IllegalArgumentException("Type " + name + " cannot extend itself");
        }
        if (parentName != null && marker != null) {
            throw new IllegalArgumentException(
                "Type " + name + " cannot extend " + parentName + " and implement marker " + marker);
        }
        ownFields = ownFields == null ? List.of() : List.copyOf(ownFields);
    }

    /**
     * Creates a root type implementing the given marker.
     *
     * @param name type name
     * @param marker capability marker, may be null
     * @param ownFields declared fields
     * @return root descriptor
     */
    public static TypeDescriptor root(String name, String marker, List<String> ownFields) {
        return new TypeDescriptor(name, null, marker, ownFields);
    }

    /**
     * Creates a type derived from a concrete parent.
     *
     * @param name type name
     * @param parentName parent type name
     * @param ownFields declared fields
     * @return derived descriptor
     */
    public static TypeDescriptor derived(String name, String parentName, List<String> ownFields) {
        Objects.requireNonNull(parentName, "parentName must not be null");
        return new TypeDescriptor(name, parentName, null, ownFields);
    }

    /**
     * Returns whether this type has no concrete parent.
     *
     * @return true for roots
     */
    public boolean isRoot() {
        return parentName == null;
    }
}
