package com.columnhierarchy.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A pre-existing type that anchored resolution may derive from.
 *
 * @param name type name
 * @param fullFields every field the type exposes, declared and inherited
 * @param markers capability markers the type satisfies, directly or through its ancestors
 */
public record BaseTypeDescriptor(
    String name,
    Set<String> fullFields,
    Set<String> markers
) {
    /**
     * Compact constructor with validation.
     */
    public BaseTypeDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(fullFields, "fullFields must not be null");
        fullFields = Collections.unmodifiableSet(new LinkedHashSet<>(fullFields));
        markers = markers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(markers));
    }

    /**
     * Checks whether this type carries the given capability marker.
     *
     * <p>A {@code null} marker means "no requirement" and is satisfied by every type.
     *
     * @param marker required marker or null
     * @return true if the marker is satisfied
     */
    public boolean satisfies(String marker) {
        return marker == null || markers.contains(marker);
    }
}
