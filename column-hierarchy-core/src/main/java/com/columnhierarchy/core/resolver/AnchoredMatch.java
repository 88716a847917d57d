package com.columnhierarchy.core.resolver;

import com.columnhierarchy.core.model.BaseTypeDescriptor;
import com.columnhierarchy.core.model.ColumnSet;

import java.util.Objects;
import java.util.Optional;

/**
 * Anchored placement of one column set.
 *
 * @param columnSet the input column set
 * @param base matched registry type, or null when the column set falls back to the marker
 * @param marker capability marker used as fallback anchor, or null
 */
public record AnchoredMatch(
    ColumnSet columnSet,
    BaseTypeDescriptor base,
    String marker
) {
    public AnchoredMatch {
        Objects.requireNonNull(columnSet, "columnSet must not be null");
    }

    public Optional<BaseTypeDescriptor> baseType() {
        return Optional.ofNullable(base);
    }
}
