package com.columnhierarchy.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TypeDescriptor} and {@link BaseTypeDescriptor}.
 */
class TypeDescriptorTest {

    @Test
    void root_hasMarkerAndNoParent() {
        TypeDescriptor type = TypeDescriptor.root("ColumnSubset1", "IColumnSubset", List.of("Id"));

        assertThat(type.isRoot()).isTrue();
        assertThat(type.marker()).isEqualTo("IColumnSubset");
    }

    @Test
    void derived_hasParentAndNoMarker() {
        TypeDescriptor type = TypeDescriptor.derived("ColumnSubset2", "ColumnSubset1", List.of("Name"));

        assertThat(type.isRoot()).isFalse();
        assertThat(type.marker()).isNull();
    }

    @Test
    void constructor_parentAndMarker_throwsIllegalArgument() {
        assertThatThrownBy(() -> new TypeDescriptor("X", "P", "M", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void derived_parentIsItself_throwsIllegalArgument() {
        assertThatThrownBy(() -> TypeDescriptor.derived("ColumnSubset1", "ColumnSubset1", List.of("Name")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot extend itself");
    }

    @Test
    void constructor_nullFields_becomesEmptyList() {
        assertThat(new TypeDescriptor("X", null, null, null).ownFields()).isEmpty();
    }

    @Test
    void satisfies_nullMarker_alwaysTrue() {
        BaseTypeDescriptor base = new BaseTypeDescriptor("Base", Set.of("Id"), null);

        assertThat(base.satisfies(null)).isTrue();
        assertThat(base.satisfies("IColumnSubset")).isFalse();
    }

    @Test
    void satisfies_declaredMarker_true() {
        BaseTypeDescriptor base = new BaseTypeDescriptor("Base", Set.of("Id"), Set.of("IColumnSubset"));

        assertThat(base.satisfies("IColumnSubset")).isTrue();
    }
}
