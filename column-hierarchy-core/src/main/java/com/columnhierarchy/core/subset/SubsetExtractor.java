package com.columnhierarchy.core.subset;

import com.columnhierarchy.core.config.ResolutionSettings;
import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.ColumnSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers field subsets that recur across two or more column sets.
 *
 * <p>Every column set of {@code k} distinct fields contributes all of its subsets of at
 * least {@code minSubsetSize} fields (the power set, enumerated with a bit mask). Subsets
 * are compared as unordered collections; a subset is kept when more than one column set
 * contributed it.
 *
 * <p><b>Scaling limit:</b> enumeration is {@code O(2^k)} per column set. Column sets wider
 * than {@code maxFieldsPerColumnSet} are rejected up front.
 *
 * <p><b>Ordering:</b> results are sorted ascending by field count; subsets of equal size
 * keep the order in which they were first discovered (input order, then bit-mask order).
 * Each returned subset iterates its fields in the column order of the column set that
 * first produced it.
 */
public class SubsetExtractor {

    private static final Logger log = LoggerFactory.getLogger(SubsetExtractor.class);

    private final int minSubsetSize;
    private final int maxFieldsPerColumnSet;

    public SubsetExtractor() {
        this(ResolutionSettings.DEFAULT_MIN_SUBSET_SIZE, ResolutionSettings.DEFAULT_MAX_FIELDS_PER_COLUMN_SET);
    }

    public SubsetExtractor(int minSubsetSize, int maxFieldsPerColumnSet) {
        if (minSubsetSize < 1) {
            throw new InvalidInputException("minSubsetSize must be at least 1: " + minSubsetSize);
        }
        if (maxFieldsPerColumnSet > ResolutionSettings.ENUMERATION_CEILING) {
            throw new InvalidInputException("maxFieldsPerColumnSet exceeds enumeration ceiling of "
                + ResolutionSettings.ENUMERATION_CEILING + ": " + maxFieldsPerColumnSet);
        }
        this.minSubsetSize = minSubsetSize;
        this.maxFieldsPerColumnSet = maxFieldsPerColumnSet;
    }

    /**
     * Returns the distinct subsets that occur in at least two column sets.
     *
     * @param columnSets all input column sets
     * @return recurring subsets, ascending by size
     * @throws InvalidInputException if the input is null or a column set is too wide
     */
    public List<Set<String>> extract(List<ColumnSet> columnSets) {
        if (columnSets == null) {
            throw new InvalidInputException("Column sets must not be null");
        }

        Map<Set<String>, Integer> occurrences = new LinkedHashMap<>();
        int enumerated = 0;
        for (int i = 0; i < columnSets.size(); i++) {
            ColumnSet columnSet = requireEnumerable(columnSets.get(i), i);
            for (Set<String> subset : enumerateSubsets(columnSet, minSubsetSize)) {
                occurrences.merge(subset, 1, Integer::sum);
                enumerated++;
            }
        }

        List<Set<String>> recurring = new ArrayList<>();
        for (Map.Entry<Set<String>, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() > 1) {
                recurring.add(entry.getKey());
            }
        }
        recurring.sort(Comparator.comparingInt(Set::size));

        log.debug("Enumerated {} subsets ({} distinct) from {} column sets, {} recurring",
            enumerated, occurrences.size(), columnSets.size(), recurring.size());
        return Collections.unmodifiableList(recurring);
    }

    /**
     * Returns the recurring subsets plus every distinct, non-empty input column set that is
     * not already among them, ascending by size.
     *
     * <p>Adding the input column sets gives every original record shape its own type.
     *
     * @param columnSets all input column sets
     * @return recurring subsets and input field sets, ascending by size
     */
    public List<Set<String>> extractWithInputs(List<ColumnSet> columnSets) {
        Set<Set<String>> pool = new LinkedHashSet<>(extract(columnSets));
        int recurring = pool.size();
        for (ColumnSet columnSet : columnSets) {
            Set<String> fields = columnSet.fieldSet();
            if (!fields.isEmpty()) {
                pool.add(fields);
            }
        }
        log.debug("Added {} input column sets to {} recurring subsets", pool.size() - recurring, recurring);

        List<Set<String>> ordered = new ArrayList<>(pool);
        ordered.sort(Comparator.comparingInt(Set::size));
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Enumerates every subset of the column set's distinct fields having at least
     * {@code minSize} members.
     *
     * <p>For {@code k} distinct fields and {@code minSize = 2} this yields
     * {@code 2^k - k - 1} subsets.
     *
     * @param columnSet column set to enumerate
     * @param minSize minimum subset size; values below 1 are treated as 1
     * @return subsets in bit-mask order
     * @throws InvalidInputException if the column set exceeds the enumeration ceiling
     */
    public static List<Set<String>> enumerateSubsets(ColumnSet columnSet, int minSize) {
        List<String> fields = new ArrayList<>(columnSet.fieldSet());
        int width = fields.size();
        if (width > ResolutionSettings.ENUMERATION_CEILING) {
            throw new InvalidInputException("Column set has " + width + " distinct fields; at most "
                + ResolutionSettings.ENUMERATION_CEILING + " can be enumerated");
        }

        int effectiveMin = Math.max(1, minSize);
        List<Set<String>> subsets = new ArrayList<>();
        for (int mask = 1; mask < (1 << width); mask++) {
            if (Integer.bitCount(mask) < effectiveMin) {
                continue;
            }
            Set<String> subset = new LinkedHashSet<>();
            for (int bit = 0; bit < width; bit++) {
                if ((mask & (1 << bit)) != 0) {
                    subset.add(fields.get(bit));
                }
            }
            subsets.add(Collections.unmodifiableSet(subset));
        }
        return subsets;
    }

    private ColumnSet requireEnumerable(ColumnSet columnSet, int index) {
        if (columnSet == null) {
            throw new InvalidInputException("Column set at index " + index + " must not be null");
        }
        if (columnSet.width() > maxFieldsPerColumnSet) {
            throw new InvalidInputException("Column set at index " + index + " has " + columnSet.width()
                + " distinct fields, more than the configured limit of " + maxFieldsPerColumnSet);
        }
        return columnSet;
    }
}
