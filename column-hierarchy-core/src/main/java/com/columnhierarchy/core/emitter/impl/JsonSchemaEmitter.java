package com.columnhierarchy.core.emitter.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.emitter.EmitterConfig;
import com.columnhierarchy.core.emitter.TypeEmitter;
import com.columnhierarchy.core.model.TypeDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Emits all types as definitions of a single JSON Schema document.
 *
 * <p>A derived type is an {@code allOf} of a {@code $ref} to its parent definition and an
 * object schema of its own fields. A parent that is not part of the emitted types (a
 * registry type in anchored mode) is recorded under {@code x-extends} instead, and a root's
 * capability marker under {@code x-implements}.
 *
 * <p>Setting {@code json-schema.fileName} overrides the default {@code types.schema.json}.
 */
public class JsonSchemaEmitter implements TypeEmitter {

    private static final Logger log = LoggerFactory.getLogger(JsonSchemaEmitter.class);

    private static final String EMITTER_ID = "json-schema";
    private static final String DISPLAY_NAME = "JSON Schema Emitter";
    private static final String FILE_EXTENSION = "json";
    private static final String CONTENT_TYPE = "application/schema+json";
    private static final String DEFAULT_FILE_NAME = "types.schema.json";
    private static final String SCHEMA_DIALECT = "https://json-schema.org/draft/2020-12/schema";
    private static final String DEFS = "$defs";
    private static final String DEF_REF_PREFIX = "#/$defs/";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String getId() {
        return EMITTER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public EmittedOutput emit(List<TypeDescriptor> types, EmitterConfig config) {
        Objects.requireNonNull(types, "types must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ObjectNode root = mapper.createObjectNode();
        root.put("$schema", SCHEMA_DIALECT);
        if (config.packageName() != null) {
            root.put("$id", config.packageName());
        }
        ObjectNode defs = root.putObject(DEFS);

        Set<String> defined = new HashSet<>();
        for (TypeDescriptor type : types) {
            defs.set(type.name(), definition(type, defined.contains(type.parentName())));
            defined.add(type.name());
        }

        String fileName = config.getSettingOrDefault("json-schema.fileName", DEFAULT_FILE_NAME);
        try {
            String content = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
            log.debug("Emitted JSON Schema with {} definitions", types.size());
            return new EmittedOutput(List.of(new EmittedFile(fileName, content, CONTENT_TYPE)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON Schema", e);
        }
    }

    private ObjectNode definition(TypeDescriptor type, boolean parentDefined) {
        ObjectNode ownSchema = mapper.createObjectNode();
        ownSchema.put("type", "object");
        ObjectNode properties = ownSchema.putObject("properties");
        for (String field : type.ownFields()) {
            properties.putObject(field).put("type", "string");
        }

        if (type.parentName() == null) {
            if (type.marker() != null) {
                ownSchema.put("x-implements", type.marker());
            }
            return ownSchema;
        }

        if (!parentDefined) {
            ownSchema.put("x-extends", type.parentName());
            return ownSchema;
        }

        ObjectNode derived = mapper.createObjectNode();
        ArrayNode allOf = derived.putArray("allOf");
        allOf.addObject().put("$ref", DEF_REF_PREFIX + type.parentName());
        allOf.add(ownSchema);
        return derived;
    }
}
