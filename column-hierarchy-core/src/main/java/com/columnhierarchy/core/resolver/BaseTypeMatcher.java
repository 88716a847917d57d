package com.columnhierarchy.core.resolver;

import com.columnhierarchy.core.model.BaseTypeDescriptor;
import com.columnhierarchy.core.model.ColumnSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the most specific registry type a column set can derive from.
 *
 * <p>Candidates are ranked by full field count, largest first; candidates with the same
 * count keep their registry order. The first candidate whose every field (declared and
 * inherited) occurs in the column set wins.
 */
public class BaseTypeMatcher {

    private static final Logger log = LoggerFactory.getLogger(BaseTypeMatcher.class);

    private final List<BaseTypeDescriptor> rankedCandidates;

    /**
     * Creates a matcher over the given candidates.
     *
     * @param candidates registry types, already filtered by any required marker
     */
    public BaseTypeMatcher(List<BaseTypeDescriptor> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        List<BaseTypeDescriptor> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingInt((BaseTypeDescriptor c) -> c.fullFields().size()).reversed());
        this.rankedCandidates = List.copyOf(ranked);
    }

    /**
     * Returns the closest base type for the column set.
     *
     * @param columnSet column set to anchor
     * @return matching base type, or empty if none of the candidates fit
     */
    public Optional<BaseTypeDescriptor> findClosest(ColumnSet columnSet) {
        Objects.requireNonNull(columnSet, "columnSet must not be null");
        Set<String> fields = columnSet.fieldSet();

        for (BaseTypeDescriptor candidate : rankedCandidates) {
            if (fields.containsAll(candidate.fullFields())) {
                log.debug("Column set [{}] matched base type {}", columnSet, candidate.name());
                return Optional.of(candidate);
            }
        }

        log.debug("Column set [{}] matched none of {} candidates", columnSet, rankedCandidates.size());
        return Optional.empty();
    }

    /**
     * Returns the candidates in the order they are tried.
     *
     * @return ranked candidates
     */
    public List<BaseTypeDescriptor> rankedCandidates() {
        return rankedCandidates;
    }
}
