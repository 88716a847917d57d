package com.columnhierarchy.core.registry;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.BaseTypeDescriptor;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registry backed by a fixed list of base types.
 */
public class InMemoryTypeRegistry implements TypeRegistry {

    private final List<BaseTypeDescriptor> types;

    /**
     * Creates a registry over the given types.
     *
     * @param types base types in registry order
     * @throws InvalidInputException if two types share a name
     */
    public InMemoryTypeRegistry(List<BaseTypeDescriptor> types) {
        Objects.requireNonNull(types, "types must not be null");
        Set<String> names = new HashSet<>();
        for (BaseTypeDescriptor type : types) {
            if (!names.add(type.name())) {
                throw new InvalidInputException("Duplicate registry type: " + type.name());
            }
        }
        this.types = List.copyOf(types);
    }

    public static InMemoryTypeRegistry empty() {
        return new InMemoryTypeRegistry(List.of());
    }

    @Override
    public List<BaseTypeDescriptor> enumerateCandidates(String marker) {
        return types.stream()
            .filter(t -> t.satisfies(marker))
            .toList();
    }

    public int size() {
        return types.size();
    }
}
