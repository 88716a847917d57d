package com.columnhierarchy.core.subset;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.ColumnSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SubsetExtractor}.
 */
class SubsetExtractorTest {

    private SubsetExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SubsetExtractor();
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 8})
    void enumerateSubsets_kDistinctFields_yieldsTwoToTheKMinusKMinusOne(int k) {
        String[] fields = IntStream.range(0, k).mapToObj(i -> "F" + i).toArray(String[]::new);

        List<Set<String>> subsets = SubsetExtractor.enumerateSubsets(ColumnSet.of(fields), 2);

        assertThat(subsets).hasSize((1 << k) - k - 1);
        assertThat(subsets).allSatisfy(s -> assertThat(s).hasSizeGreaterThanOrEqualTo(2));
        assertThat(subsets).doesNotHaveDuplicates();
    }

    @Test
    void enumerateSubsets_keepsColumnOrderWithinSubset() {
        List<Set<String>> subsets = SubsetExtractor.enumerateSubsets(ColumnSet.of("C", "A", "B"), 3);

        assertThat(subsets).hasSize(1);
        assertThat(subsets.get(0)).containsExactly("C", "A", "B");
    }

    @Test
    void enumerateSubsets_duplicateFields_collapseBeforeEnumeration() {
        List<Set<String>> subsets = SubsetExtractor.enumerateSubsets(ColumnSet.of("A", "B", "A"), 2);

        assertThat(subsets).containsExactly(Set.of("A", "B"));
    }

    @Test
    void extract_sharedPairsOnly_retainsExactlyThePairs() {
        List<Set<String>> result = extractor.extract(List.of(
            ColumnSet.of("A", "B", "C"),
            ColumnSet.of("A", "B", "D"),
            ColumnSet.of("A", "C", "D")));

        assertThat(result).containsExactly(Set.of("A", "B"), Set.of("A", "C"), Set.of("A", "D"));
    }

    @Test
    void extract_orderedAscendingBySize() {
        List<Set<String>> result = extractor.extract(List.of(
            ColumnSet.of("Id", "DateCreated", "DateDeleted", "Name"),
            ColumnSet.of("Id", "DateCreated", "DateDeleted", "Name"),
            ColumnSet.of("Id", "Name")));

        List<Integer> sizes = result.stream().map(Set::size).toList();
        List<Integer> sorted = new ArrayList<>(sizes);
        Collections.sort(sorted);
        assertThat(sizes).isEqualTo(sorted);
        assertThat(result.get(result.size() - 1)).containsExactlyInAnyOrder("Id", "DateCreated", "DateDeleted", "Name");
    }

    @Test
    void extract_subsetInSingleColumnSet_isDropped() {
        List<Set<String>> result = extractor.extract(List.of(
            ColumnSet.of("Id", "DateCreated", "DateDeleted"),
            ColumnSet.of("Id", "DateCreated", "Name"),
            ColumnSet.of("Id", "Name")));

        assertThat(result).containsExactly(Set.of("Id", "DateCreated"), Set.of("Id", "Name"));
    }

    @Test
    void extract_identicalColumnSets_countEachOccurrence() {
        List<Set<String>> result = extractor.extract(List.of(
            ColumnSet.of("A", "B"),
            ColumnSet.of("B", "A")));

        assertThat(result).containsExactly(Set.of("A", "B"));
    }

    @Test
    void extract_emptyInput_returnsEmpty() {
        assertThat(extractor.extract(List.of())).isEmpty();
    }

    @Test
    void extract_singleFieldSets_produceNothingAtDefaultMinimum() {
        assertThat(extractor.extract(List.of(ColumnSet.of("A"), ColumnSet.of("A")))).isEmpty();
    }

    @Test
    void extract_minimumOfOne_includesSingleFields() {
        SubsetExtractor singles = new SubsetExtractor(1, 20);

        List<Set<String>> result = singles.extract(List.of(ColumnSet.of("A", "B"), ColumnSet.of("A", "C")));

        assertThat(result).containsExactly(Set.of("A"));
    }

    @Test
    void extract_nullInput_throwsInvalidInput() {
        assertThatThrownBy(() -> extractor.extract(null))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void extract_nullColumnSet_throwsInvalidInput() {
        List<ColumnSet> input = new ArrayList<>();
        input.add(ColumnSet.of("A", "B"));
        input.add(null);

        assertThatThrownBy(() -> extractor.extract(input))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("index 1");
    }

    @Test
    void extract_columnSetWiderThanLimit_throwsInvalidInput() {
        SubsetExtractor narrow = new SubsetExtractor(2, 3);

        assertThatThrownBy(() -> narrow.extract(List.of(ColumnSet.of("A", "B", "C", "D"))))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("limit of 3");
    }

    @Test
    void constructor_limitAboveCeiling_throwsInvalidInput() {
        assertThatThrownBy(() -> new SubsetExtractor(2, 31))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void constructor_minimumBelowOne_throwsInvalidInput() {
        assertThatThrownBy(() -> new SubsetExtractor(0, 20))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void extractWithInputs_addsInputColumnSetsNotAlreadyRecurring() {
        List<Set<String>> result = extractor.extractWithInputs(List.of(
            ColumnSet.of("Id", "DateCreated", "DateDeleted"),
            ColumnSet.of("Id", "DateCreated", "Name"),
            ColumnSet.of("Id", "Name")));

        assertThat(result).containsExactly(
            Set.of("Id", "DateCreated"),
            Set.of("Id", "Name"),
            Set.of("Id", "DateCreated", "DateDeleted"),
            Set.of("Id", "DateCreated", "Name"));
    }

    @Test
    void extractWithInputs_singleColumnSet_returnsItAlone() {
        List<Set<String>> result = extractor.extractWithInputs(List.of(ColumnSet.of("A", "B", "C")));

        assertThat(result).containsExactly(Set.of("A", "B", "C"));
    }

    @Test
    void extractWithInputs_emptyColumnSet_isSkipped() {
        List<Set<String>> result = extractor.extractWithInputs(List.of(new ColumnSet(List.of())));

        assertThat(result).isEmpty();
    }
}
