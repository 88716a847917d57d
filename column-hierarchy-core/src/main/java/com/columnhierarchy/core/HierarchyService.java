package com.columnhierarchy.core;

import com.columnhierarchy.core.config.ResolutionSettings;
import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.BaseTypeDescriptor;
import com.columnhierarchy.core.model.ColumnSet;
import com.columnhierarchy.core.model.HierarchyResult;
import com.columnhierarchy.core.model.ResolutionMode;
import com.columnhierarchy.core.model.TypeDescriptor;
import com.columnhierarchy.core.registry.TypeRegistry;
import com.columnhierarchy.core.resolver.AnchoredMatch;
import com.columnhierarchy.core.resolver.BaseTypeMatcher;
import com.columnhierarchy.core.resolver.HierarchyResolver;
import com.columnhierarchy.core.resolver.SubsetForest;
import com.columnhierarchy.core.subset.SubsetExtractor;
import com.columnhierarchy.core.synth.TypeSynthesizer;
import com.columnhierarchy.core.util.IdSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for resolving a batch of column sets into a type hierarchy.
 *
 * <p>The pipeline is:
 * <ol>
 *   <li>validate the input</li>
 *   <li>unanchored: {@link SubsetExtractor} finds recurring subsets, {@link HierarchyResolver}
 *       chains them; anchored: {@link BaseTypeMatcher} picks a registry base per column set</li>
 *   <li>{@link TypeSynthesizer} produces the ordered {@link TypeDescriptor}s</li>
 * </ol>
 *
 * <p>The service holds only its immutable settings. Every call allocates its own forest
 * and id sequence, so one instance can serve concurrent callers. A call either returns
 * the complete result or throws; there are no partial results.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HierarchyService service = new HierarchyService(ResolutionSettings.defaults());
 * HierarchyResult result = service.resolve(List.of(
 *     ColumnSet.of("Id", "DateCreated", "DateDeleted"),
 *     ColumnSet.of("Id", "DateCreated", "Name"),
 *     ColumnSet.of("Id", "Name")));
 * result.types().forEach(System.out::println);
 * }</pre>
 */
public class HierarchyService {

    private static final Logger log = LoggerFactory.getLogger(HierarchyService.class);

    private final ResolutionSettings settings;
    private final SubsetExtractor extractor;
    private final HierarchyResolver resolver;
    private final TypeSynthesizer synthesizer;

    public HierarchyService() {
        this(ResolutionSettings.defaults());
    }

    public HierarchyService(ResolutionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.extractor = new SubsetExtractor(settings.minSubsetSize(), settings.maxFieldsPerColumnSet());
        this.resolver = new HierarchyResolver();
        this.synthesizer = new TypeSynthesizer(settings.typeNamePrefix());
    }

    /**
     * Resolves the column sets with the given strategy.
     *
     * @param mode resolution strategy
     * @param columnSets input column sets
     * @param registry registry for anchored mode; ignored in unanchored mode
     * @return resolution result
     * @throws InvalidInputException if the input is absent, or anchored mode has no registry
     */
    public HierarchyResult resolve(ResolutionMode mode, List<ColumnSet> columnSets, TypeRegistry registry) {
        Objects.requireNonNull(mode, "mode must not be null");
        return switch (mode) {
            case UNANCHORED -> resolve(columnSets);
            case ANCHORED -> resolveAnchored(columnSets, registry);
        };
    }

    /**
     * Discovers recurring subsets and builds a fresh inheritance forest.
     *
     * @param columnSets input column sets
     * @return resolution result with forest nodes and types
     * @throws InvalidInputException if the input is absent or malformed
     */
    public HierarchyResult resolve(List<ColumnSet> columnSets) {
        validate(columnSets);
        log.info("Resolving {} column sets (unanchored)", columnSets.size());

        List<Set<String>> subsets = settings.includeInputColumnSets()
            ? extractor.extractWithInputs(columnSets)
            : extractor.extract(columnSets);

        IdSequence ids = IdSequence.startingAt(settings.firstTypeId());
        SubsetForest forest = resolver.resolveUnanchored(subsets, ids);
        List<TypeDescriptor> types = synthesizer.synthesize(forest, settings.capabilityMarker());

        log.info("Resolved {} types ({} roots)", types.size(),
            types.stream().filter(TypeDescriptor::isRoot).count());
        return new HierarchyResult(ResolutionMode.UNANCHORED, columnSets, forest.snapshot(), types);
    }

    /**
     * Derives one type per column set from the closest registry type.
     *
     * <p>When a capability marker is configured, only registry types satisfying it are
     * candidates, and unmatched column sets implement the marker directly.
     *
     * @param columnSets input column sets
     * @param registry candidate base types
     * @return resolution result with one type per column set, in input order
     * @throws InvalidInputException if the input or registry is absent
     * @throws com.columnhierarchy.core.exception.UnresolvedAnchorException if a column set
     *         cannot be anchored and the settings demand failure
     */
    public HierarchyResult resolveAnchored(List<ColumnSet> columnSets, TypeRegistry registry) {
        validate(columnSets);
        if (registry == null) {
            throw new InvalidInputException("Anchored resolution requires a type registry");
        }

        String marker = settings.capabilityMarker();
        List<BaseTypeDescriptor> candidates = registry.enumerateCandidates(marker);
        log.info("Resolving {} column sets against {} registry candidates (marker: {})",
            columnSets.size(), candidates.size(), marker);

        BaseTypeMatcher matcher = new BaseTypeMatcher(candidates);
        List<AnchoredMatch> matches = resolver.resolveAnchored(columnSets, matcher, marker,
            settings.failOnUnresolvedAnchor());
        Set<String> registryNames = registry.enumerateCandidates(null).stream()
            .map(BaseTypeDescriptor::name)
            .collect(Collectors.toSet());
        List<TypeDescriptor> types = synthesizer.synthesizeAnchored(matches,
            IdSequence.startingAt(settings.firstTypeId()), registryNames);

        log.info("Resolved {} anchored types", types.size());
        return new HierarchyResult(ResolutionMode.ANCHORED, columnSets, List.of(), types);
    }

    public ResolutionSettings settings() {
        return settings;
    }

    private void validate(List<ColumnSet> columnSets) {
        if (columnSets == null) {
            throw new InvalidInputException("Column sets must not be null");
        }
        for (int i = 0; i < columnSets.size(); i++) {
            if (columnSets.get(i) == null) {
                throw new InvalidInputException("Column set at index " + i + " must not be null");
            }
        }
    }
}
