package com.columnhierarchy.core.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk form of a type registry.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * types:
 *   - name: Entity
 *     implements: [IColumnSubset]
 *     fields: [Id]
 *   - name: AuditedEntity
 *     extends: Entity
 *     fields: [DateCreated]
 * }</pre>
 *
 * @param types type definitions in registry order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryDocument(
    @JsonProperty("types") List<TypeDefinition> types
) {
    /**
     * One registry type.
     *
     * @param name type name
     * @param parent name of the type it extends, or null
     * @param markers capability markers it implements directly
     * @param fields fields it declares itself
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypeDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("extends") String parent,
        @JsonProperty("implements") List<String> markers,
        @JsonProperty("fields") List<String> fields
    ) {}
}
