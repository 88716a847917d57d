package com.columnhierarchy.core.resolver;

import com.columnhierarchy.core.exception.DomainViolationException;
import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.SubsetInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Indexed store of subset nodes with single-parent links.
 *
 * <p>Nodes are kept in insertion order and addressed by id; a parent link is an id into
 * the same store. A parent can be assigned once. Assigning it removes the parent's full
 * field set from the child's own fields, so no field is declared twice along a chain.
 *
 * <p>A forest belongs to a single resolution run and is not thread-safe.
 */
public final class SubsetForest {

    private final Map<Integer, Node> nodes = new LinkedHashMap<>();

    /**
     * Adds a parentless node whose own fields are its full field set.
     *
     * @param id unique node id
     * @param fields full field set, non-empty
     * @return the id
     * @throws InvalidInputException if the id is taken or the field set is empty
     */
    public int add(int id, Set<String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new InvalidInputException("Subset " + id + " must have at least one field");
        }
        if (nodes.containsKey(id)) {
            throw new InvalidInputException("Duplicate subset id: " + id);
        }
        nodes.put(id, new Node(id, fields));
        return id;
    }

    /**
     * Makes {@code parentId} the parent of {@code childId}.
     *
     * @param childId node receiving the parent
     * @param parentId node becoming the parent
     * @throws DomainViolationException if the child already has a parent, the parent's
     *         fields are not contained in the child's, or the link would close a cycle
     */
    public void setParent(int childId, int parentId) {
        Node child = node(childId);
        Node parent = node(parentId);

        if (child.parentId != null) {
            throw new DomainViolationException("Subset " + child + " already has a parent subset " + child.parentId);
        }
        if (!child.fullFields.containsAll(parent.fullFields)) {
            throw new DomainViolationException("Subset " + parent + " is not contained in " + child);
        }
        for (Integer ancestor = parentId; ancestor != null; ancestor = node(ancestor).parentId) {
            if (ancestor == childId) {
                throw new DomainViolationException("Linking " + child + " to " + parent + " would create a cycle");
            }
        }

        child.parentId = parentId;
        Set<String> remaining = new LinkedHashSet<>(child.ownFields);
        remaining.removeAll(parent.fullFields);
        child.ownFields = Collections.unmodifiableSet(remaining);
    }

    public Optional<Integer> parentOf(int id) {
        return Optional.ofNullable(node(id).parentId);
    }

    public Set<String> fullFields(int id) {
        return node(id).fullFields;
    }

    public Set<String> ownFields(int id) {
        return node(id).ownFields;
    }

    /**
     * Returns the ancestors of a node, nearest first.
     *
     * @param id node id
     * @return parent, grandparent, and so on up to the root
     */
    public List<Integer> ancestors(int id) {
        List<Integer> chain = new ArrayList<>();
        for (Integer current = node(id).parentId; current != null; current = node(current).parentId) {
            chain.add(current);
        }
        return chain;
    }

    /**
     * Returns node ids in insertion order.
     *
     * @return ids
     */
    public List<Integer> ids() {
        return List.copyOf(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    /**
     * Returns an immutable view of every node in insertion order.
     *
     * @return node snapshots
     */
    public List<SubsetInfo> snapshot() {
        return nodes.values().stream()
            .map(n -> new SubsetInfo(n.id, n.fullFields, n.ownFields, n.parentId))
            .toList();
    }

    private Node node(int id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown subset id: " + id);
        }
        return node;
    }

    private static final class Node {
        private final int id;
        private final Set<String> fullFields;
        private Set<String> ownFields;
        private Integer parentId;

        private Node(int id, Set<String> fields) {
            this.id = id;
            this.fullFields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
            this.ownFields = this.fullFields;
        }

        @Override
        public String toString() {
            return id + "(" + String.join(",", fullFields) + ")";
        }
    }
}
