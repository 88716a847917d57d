package com.columnhierarchy.core.registry;

import com.columnhierarchy.core.model.BaseTypeDescriptor;

import java.util.List;

/**
 * Source of existing types that anchored resolution may derive from.
 *
 * <p>Implementations decide where the types come from (a registry file, a deployed
 * component, a schema service). The resolver only needs the flattened view: each
 * candidate's full field set and the markers it satisfies.
 *
 * @see InMemoryTypeRegistry
 * @see RegistryLoader
 */
public interface TypeRegistry {

    /**
     * Returns the candidate base types, in registry order.
     *
     * @param marker capability marker candidates must satisfy, or null for all types
     * @return candidate types
     */
    List<BaseTypeDescriptor> enumerateCandidates(String marker);
}
