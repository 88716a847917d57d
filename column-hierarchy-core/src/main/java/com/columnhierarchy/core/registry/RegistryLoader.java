package com.columnhierarchy.core.registry;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.BaseTypeDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a type registry from a YAML or JSON file.
 *
 * <p>Registry types declare only their own fields and markers; the loader flattens each
 * type by walking its {@code extends} chain, so the resulting {@link BaseTypeDescriptor}s
 * carry inherited fields and inherited markers as well.
 *
 * <p>Unlike the configuration loader, a broken registry fails loudly: anchoring against
 * a partial registry would silently produce a different hierarchy.
 */
public class RegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(RegistryLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RegistryLoader() {
    }

    /**
     * Reads and flattens a registry file. JSON is accepted as it is a subset of YAML.
     *
     * @param registryPath registry file
     * @return in-memory registry
     * @throws InvalidInputException if the file is missing, unreadable, or inconsistent
     */
    public static InMemoryTypeRegistry load(Path registryPath) {
        if (!Files.isRegularFile(registryPath) || !Files.isReadable(registryPath)) {
            throw new InvalidInputException("Registry file not found or not readable: " + registryPath);
        }

        RegistryDocument document;
        try {
            log.debug("Loading type registry from: {}", registryPath);
            document = YAML_MAPPER.readValue(registryPath.toFile(), RegistryDocument.class);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to parse registry file " + registryPath + ": " + e.getMessage(), e);
        }

        InMemoryTypeRegistry registry = fromDocument(document);
        log.info("Loaded {} registry types from: {}", registry.size(), registryPath);
        return registry;
    }

    /**
     * Flattens a registry document.
     *
     * @param document parsed registry, may be null (empty registry)
     * @return in-memory registry
     * @throws InvalidInputException on missing names, duplicate names, unknown parents or cycles
     */
    public static InMemoryTypeRegistry fromDocument(RegistryDocument document) {
        if (document == null || document.types() == null) {
            return InMemoryTypeRegistry.empty();
        }

        Map<String, RegistryDocument.TypeDefinition> byName = new LinkedHashMap<>();
        for (RegistryDocument.TypeDefinition definition : document.types()) {
            if (definition == null || definition.name() == null || definition.name().isBlank()) {
                throw new InvalidInputException("Registry type without a name");
            }
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new InvalidInputException("Duplicate registry type: " + definition.name());
            }
        }

        List<BaseTypeDescriptor> flattened = new ArrayList<>();
        for (RegistryDocument.TypeDefinition definition : byName.values()) {
            flattened.add(flatten(definition, byName));
        }
        return new InMemoryTypeRegistry(flattened);
    }

    private static BaseTypeDescriptor flatten(RegistryDocument.TypeDefinition definition,
                                              Map<String, RegistryDocument.TypeDefinition> byName) {
        List<RegistryDocument.TypeDefinition> chain = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        for (RegistryDocument.TypeDefinition current = definition; current != null; ) {
            if (!visited.add(current.name())) {
                throw new InvalidInputException("Inheritance cycle in registry: " + String.join(" -> ", visited)
                    + " -> " + current.name());
            }
            chain.add(0, current);
            String parentName = current.parent();
            if (parentName == null || parentName.isBlank()) {
                current = null;
            } else {
                current = byName.get(parentName);
                if (current == null) {
                    throw new InvalidInputException("Registry type " + definition.name()
                        + " extends unknown type " + parentName);
                }
            }
        }

        // root first, so inherited fields precede declared ones
        Set<String> fields = new LinkedHashSet<>();
        Set<String> markers = new LinkedHashSet<>();
        for (RegistryDocument.TypeDefinition link : chain) {
            if (link.fields() != null) {
                fields.addAll(link.fields());
            }
            if (link.markers() != null) {
                markers.addAll(link.markers());
            }
        }
        return new BaseTypeDescriptor(definition.name(), fields, markers);
    }
}
