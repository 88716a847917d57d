package com.columnhierarchy.core.synth;

import com.columnhierarchy.core.model.BaseTypeDescriptor;
import com.columnhierarchy.core.model.TypeDescriptor;
import com.columnhierarchy.core.resolver.AnchoredMatch;
import com.columnhierarchy.core.resolver.SubsetForest;
import com.columnhierarchy.core.util.IdSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns resolved hierarchies into type descriptors, parents before children.
 *
 * <p>Type names are {@code prefix + id}. Root types carry the capability marker, when one
 * is configured.
 */
public class TypeSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(TypeSynthesizer.class);

    private final String typeNamePrefix;

    public TypeSynthesizer(String typeNamePrefix) {
        this.typeNamePrefix = Objects.requireNonNull(typeNamePrefix, "typeNamePrefix must not be null");
    }

    /**
     * Emits one descriptor per forest node.
     *
     * <p>Nodes are taken in forest order; a node whose parent has not been emitted yet is
     * preceded by its parent chain.
     *
     * @param forest resolved forest
     * @param marker capability marker for root types, or null
     * @return descriptors, parents first
     */
    public List<TypeDescriptor> synthesize(SubsetForest forest, String marker) {
        Objects.requireNonNull(forest, "forest must not be null");

        List<TypeDescriptor> types = new ArrayList<>(forest.size());
        Set<Integer> emitted = new HashSet<>();
        for (int id : forest.ids()) {
            emitWithAncestors(forest, id, marker, emitted, types);
        }

        log.debug("Synthesized {} types from subset forest", types.size());
        return List.copyOf(types);
    }

    /**
     * Emits one descriptor per anchored column set, in input order.
     *
     * <p>A matched type declares the column set's fields minus every field of its base
     * type; an unmatched one declares all of them and implements the marker.
     *
     * @param matches anchored matches
     * @param ids id allocator for the new types
     * @return descriptors in input order
     */
    public List<TypeDescriptor> synthesizeAnchored(List<AnchoredMatch> matches, IdSequence ids) {
        return synthesizeAnchored(matches, ids, Set.of());
    }

    /**
     * Emits one descriptor per anchored column set, skipping ids whose type name is taken.
     *
     * <p>Registry types keep their names; a new type never reuses one, so it cannot end
     * up extending itself.
     *
     * @param matches anchored matches
     * @param ids id allocator for the new types
     * @param takenNames names already in use, typically every registry type
     * @return descriptors in input order
     */
    public List<TypeDescriptor> synthesizeAnchored(List<AnchoredMatch> matches, IdSequence ids,
                                                   Set<String> takenNames) {
        Objects.requireNonNull(matches, "matches must not be null");
        Objects.requireNonNull(takenNames, "takenNames must not be null");

        List<TypeDescriptor> types = new ArrayList<>(matches.size());
        for (AnchoredMatch match : matches) {
            String name = nextFreeName(ids, takenNames);
            Set<String> fields = new LinkedHashSet<>(match.columnSet().fieldSet());
            Optional<BaseTypeDescriptor> base = match.baseType();
            if (base.isPresent()) {
                fields.removeAll(base.get().fullFields());
                types.add(TypeDescriptor.derived(name, base.get().name(), List.copyOf(fields)));
            } else {
                types.add(TypeDescriptor.root(name, match.marker(), List.copyOf(fields)));
            }
        }

        log.debug("Synthesized {} anchored types", types.size());
        return List.copyOf(types);
    }

    /**
     * Returns the type name for a node id.
     *
     * @param id node id
     * @return type name
     */
    public String typeName(int id) {
        return typeNamePrefix + id;
    }

    private String nextFreeName(IdSequence ids, Set<String> takenNames) {
        String name = typeName(ids.next());
        while (takenNames.contains(name)) {
            log.debug("Type name {} is already taken, skipping", name);
            name = typeName(ids.next());
        }
        return name;
    }

    private void emitWithAncestors(SubsetForest forest, int id, String marker,
                                   Set<Integer> emitted, List<TypeDescriptor> types) {
        if (emitted.contains(id)) {
            return;
        }
        Optional<Integer> parent = forest.parentOf(id);
        parent.ifPresent(p -> emitWithAncestors(forest, p, marker, emitted, types));

        List<String> ownFields = List.copyOf(forest.ownFields(id));
        types.add(parent
            .map(p -> TypeDescriptor.derived(typeName(id), typeName(p), ownFields))
            .orElseGet(() -> TypeDescriptor.root(typeName(id), marker, ownFields)));
        emitted.add(id);
    }
}
