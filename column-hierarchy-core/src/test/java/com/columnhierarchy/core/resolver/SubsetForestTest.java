package com.columnhierarchy.core.resolver;

import com.columnhierarchy.core.exception.DomainViolationException;
import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.SubsetInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SubsetForest}.
 */
class SubsetForestTest {

    private SubsetForest forest;

    @BeforeEach
    void setUp() {
        forest = new SubsetForest();
        forest.add(1, Set.of("Id", "DateCreated"));
        forest.add(2, Set.of("Id", "Name"));
        forest.add(3, Set.of("Id", "DateCreated", "DateDeleted"));
    }

    @Test
    void add_newNode_ownFieldsEqualFullFields() {
        assertThat(forest.ownFields(3)).isEqualTo(forest.fullFields(3));
        assertThat(forest.parentOf(3)).isEmpty();
    }

    @Test
    void add_duplicateId_throwsInvalidInput() {
        assertThatThrownBy(() -> forest.add(1, Set.of("X", "Y")))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void add_emptyFields_throwsInvalidInput() {
        assertThatThrownBy(() -> forest.add(9, Set.of()))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void setParent_subtractsParentFieldsFromOwnFields() {
        forest.setParent(3, 1);

        assertThat(forest.parentOf(3)).contains(1);
        assertThat(forest.ownFields(3)).containsExactly("DateDeleted");
        assertThat(forest.fullFields(3)).containsExactlyInAnyOrder("Id", "DateCreated", "DateDeleted");
    }

    @Test
    void setParent_secondAssignment_throwsAndKeepsFirst() {
        forest.add(4, Set.of("Id", "DateCreated", "Name"));
        forest.setParent(4, 1);

        assertThatThrownBy(() -> forest.setParent(4, 2))
            .isInstanceOf(DomainViolationException.class)
            .hasMessageContaining("already has a parent");

        assertThat(forest.parentOf(4)).contains(1);
        assertThat(forest.ownFields(4)).containsExactly("Name");
    }

    @Test
    void setParent_parentNotContained_throwsDomainViolation() {
        assertThatThrownBy(() -> forest.setParent(3, 2))
            .isInstanceOf(DomainViolationException.class);
        assertThat(forest.parentOf(3)).isEmpty();
    }

    @Test
    void setParent_cycle_throwsDomainViolation() {
        SubsetForest looped = new SubsetForest();
        looped.add(1, Set.of("A"));
        looped.add(2, Set.of("A"));
        looped.setParent(2, 1);

        assertThatThrownBy(() -> looped.setParent(1, 2))
            .isInstanceOf(DomainViolationException.class)
            .hasMessageContaining("cycle");
    }

    @Test
    void setParent_selfLink_throwsDomainViolation() {
        assertThatThrownBy(() -> forest.setParent(1, 1))
            .isInstanceOf(DomainViolationException.class);
    }

    @Test
    void setParent_unknownId_throwsIllegalArgument() {
        assertThatThrownBy(() -> forest.setParent(3, 42))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("42");
    }

    @Test
    void ancestors_chainOfThree_unionOfOwnFieldsEqualsFullFields() {
        SubsetForest chain = new SubsetForest();
        chain.add(1, Set.of("A", "B"));
        chain.add(2, Set.of("A", "B", "C"));
        chain.add(3, Set.of("A", "B", "C", "D"));
        chain.setParent(2, 1);
        chain.setParent(3, 2);

        assertThat(chain.ancestors(3)).containsExactly(2, 1);

        Set<String> union = new LinkedHashSet<>(chain.ownFields(3));
        int declared = chain.ownFields(3).size();
        for (int ancestor : chain.ancestors(3)) {
            union.addAll(chain.ownFields(ancestor));
            declared += chain.ownFields(ancestor).size();
        }
        assertThat(union).isEqualTo(chain.fullFields(3));
        assertThat(declared).as("no field declared twice along the chain").isEqualTo(union.size());
    }

    @Test
    void snapshot_reflectsNodesInInsertionOrder() {
        forest.setParent(3, 1);

        List<SubsetInfo> snapshot = forest.snapshot();

        assertThat(snapshot).extracting(SubsetInfo::id).containsExactly(1, 2, 3);
        assertThat(snapshot.get(2).parentId()).isEqualTo(1);
        assertThat(snapshot.get(2).ownFields()).containsExactly("DateDeleted");
        assertThat(snapshot.get(0).isRoot()).isTrue();
    }

    @Test
    void ids_sizeAndContains_reportNodes() {
        assertThat(forest.ids()).containsExactly(1, 2, 3);
        assertThat(forest.size()).isEqualTo(3);
        assertThat(forest.contains(2)).isTrue();
        assertThat(forest.contains(7)).isFalse();
    }
}
