package com.columnhierarchy.core.resolver;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.exception.UnresolvedAnchorException;
import com.columnhierarchy.core.model.BaseTypeDescriptor;
import com.columnhierarchy.core.model.ColumnSet;
import com.columnhierarchy.core.util.IdSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the parent/child structure for both resolution modes.
 *
 * <h2>Unanchored</h2>
 * <p>Each subset becomes a node, ids handed out in the given (ascending) order. Nodes are
 * then visited largest first. For each node, the not-yet-visited nodes are scanned in the
 * same largest-first order and the first one whose fields are all contained in the
 * current node becomes its parent. Nodes of equal size are visited in discovery order,
 * which makes the earliest-discovered subset win a tie between equally large parents.
 *
 * <p>The largest-first order is a stable descending sort, not the ascending list
 * reversed. Reversing would put the last-discovered subset first among equals and flip
 * every tie. Visiting order and candidate order must change together, and
 * {@code resolveUnanchored_equallyLargeParents_earliestDiscoveredWins} pins the current
 * choice.
 *
 * <p>Example: for subsets {@code (Id,DateCreated)}, {@code (Id,Name)},
 * {@code (Id,DateCreated,DateDeleted)} and {@code (Id,DateCreated,Name)} the forest is:
 * <pre>
 * (Id,DateCreated)
 * (Id,Name)
 * (DateDeleted) -> (Id,DateCreated)
 * (Name) -> (Id,DateCreated)
 * </pre>
 *
 * <h2>Anchored</h2>
 * <p>Every column set is matched on its own against the registry candidates; no chains
 * are formed between the new types.
 */
public class HierarchyResolver {

    private static final Logger log = LoggerFactory.getLogger(HierarchyResolver.class);

    /**
     * Chains distinct subsets into a forest.
     *
     * @param subsets distinct, non-empty field subsets, ascending by size
     * @param ids id allocator for the new nodes
     * @return resolved forest
     * @throws InvalidInputException if the subsets are null, empty sets, or not distinct
     */
    public SubsetForest resolveUnanchored(List<Set<String>> subsets, IdSequence ids) {
        if (subsets == null) {
            throw new InvalidInputException("Subsets must not be null");
        }

        SubsetForest forest = new SubsetForest();
        Set<Set<String>> seen = new HashSet<>();
        for (Set<String> subset : subsets) {
            if (subset != null && !seen.add(subset)) {
                throw new InvalidInputException("Subsets must be distinct, found duplicate (" + String.join(",", subset) + ")");
            }
            forest.add(ids.next(), subset);
        }

        List<Integer> largestFirst = new ArrayList<>(forest.ids());
        largestFirst.sort(Comparator.comparingInt((Integer id) -> forest.fullFields(id).size()).reversed());

        int linked = 0;
        for (int i = 0; i < largestFirst.size() - 1; i++) {
            int current = largestFirst.get(i);
            Optional<Integer> parent = findParent(forest, current, largestFirst.subList(i + 1, largestFirst.size()));
            if (parent.isPresent()) {
                forest.setParent(current, parent.get());
                linked++;
            }
        }

        log.debug("Resolved {} subsets into {} roots and {} derived nodes",
            forest.size(), forest.size() - linked, linked);
        return forest;
    }

    /**
     * Matches every column set against the registry candidates independently.
     *
     * @param columnSets input column sets
     * @param matcher matcher over the registry candidates
     * @param marker capability marker used when nothing matches, or null
     * @param failOnUnresolved whether a column set with neither match nor marker fails the run
     * @return one match per column set, in input order
     * @throws UnresolvedAnchorException if {@code failOnUnresolved} is set and a column set
     *         cannot be anchored
     */
    public List<AnchoredMatch> resolveAnchored(List<ColumnSet> columnSets, BaseTypeMatcher matcher,
                                               String marker, boolean failOnUnresolved) {
        if (columnSets == null) {
            throw new InvalidInputException("Column sets must not be null");
        }

        List<AnchoredMatch> matches = new ArrayList<>();
        for (ColumnSet columnSet : columnSets) {
            Optional<BaseTypeDescriptor> base = matcher.findClosest(columnSet);
            if (base.isEmpty() && marker == null && failOnUnresolved) {
                throw new UnresolvedAnchorException(
                    "No base type matches column set [" + columnSet + "] and no capability marker is configured");
            }
            matches.add(new AnchoredMatch(columnSet, base.orElse(null), marker));
        }

        long anchored = matches.stream().filter(m -> m.base() != null).count();
        log.debug("Anchored {} of {} column sets to registry types", anchored, matches.size());
        return matches;
    }

    private Optional<Integer> findParent(SubsetForest forest, int nodeId, List<Integer> candidates) {
        Set<String> fields = forest.fullFields(nodeId);
        for (Integer candidate : candidates) {
            if (fields.containsAll(forest.fullFields(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
