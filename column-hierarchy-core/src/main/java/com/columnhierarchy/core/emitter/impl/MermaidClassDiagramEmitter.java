package com.columnhierarchy.core.emitter.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.emitter.EmitterConfig;
import com.columnhierarchy.core.emitter.TypeEmitter;
import com.columnhierarchy.core.model.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Emits the type hierarchy as a Mermaid class diagram embedded in Markdown.
 *
 * <p>Inheritance is drawn with {@code <|--}, marker implementation with {@code <|..}.
 * Parents outside the emitted set (registry types) appear as empty classes.
 *
 * @see <a href="https://mermaid.js.org/syntax/classDiagram.html">Mermaid class diagrams</a>
 */
public class MermaidClassDiagramEmitter implements TypeEmitter {

    private static final Logger log = LoggerFactory.getLogger(MermaidClassDiagramEmitter.class);

    private static final String EMITTER_ID = "mermaid";
    private static final String DISPLAY_NAME = "Mermaid Class Diagram Emitter";
    private static final String FILE_EXTENSION = "md";
    private static final String CONTENT_TYPE = "text/markdown";
    private static final String FILE_NAME = "type-hierarchy.md";

    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String CLASS_DIAGRAM = "classDiagram\n";
    private static final String NO_TYPES_NOTE = "  note \"No types resolved\"\n";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

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

        StringBuilder sb = new StringBuilder();
        sb.append("# Type Hierarchy\n\n");
        sb.append(CODE_BLOCK_START).append(CLASS_DIAGRAM);

        if (types.isEmpty()) {
            sb.append(NO_TYPES_NOTE);
        } else {
            appendClasses(sb, types, config.fieldType());
            appendExternalParents(sb, types);
            appendMarkers(sb, types);
            appendRelations(sb, types);
        }

        sb.append(CODE_BLOCK_END);
        log.debug("Emitted Mermaid class diagram for {} types", types.size());
        return new EmittedOutput(List.of(new EmittedFile(FILE_NAME, sb.toString(), CONTENT_TYPE)));
    }

    private void appendClasses(StringBuilder sb, List<TypeDescriptor> types, String fieldType) {
        for (TypeDescriptor type : types) {
            sb.append("  class ").append(sanitize(type.name())).append(" {\n");
            for (String field : type.ownFields()) {
                sb.append("    +").append(fieldType).append(' ').append(sanitize(field)).append('\n');
            }
            sb.append("  }\n");
        }
    }

    private void appendExternalParents(StringBuilder sb, List<TypeDescriptor> types) {
        Set<String> known = new LinkedHashSet<>();
        types.forEach(t -> known.add(t.name()));
        Set<String> external = new LinkedHashSet<>();
        for (TypeDescriptor type : types) {
            if (type.parentName() != null && !known.contains(type.parentName())) {
                external.add(type.parentName());
            }
        }
        external.forEach(name -> sb.append("  class ").append(sanitize(name)).append('\n'));
    }

    private void appendMarkers(StringBuilder sb, List<TypeDescriptor> types) {
        Set<String> markers = new LinkedHashSet<>();
        for (TypeDescriptor type : types) {
            if (type.marker() != null) {
                markers.add(type.marker());
            }
        }
        for (String marker : markers) {
            sb.append("  class ").append(sanitize(marker)).append(" {\n");
            sb.append("    <<interface>>\n");
            sb.append("  }\n");
        }
    }

    private void appendRelations(StringBuilder sb, List<TypeDescriptor> types) {
        for (TypeDescriptor type : types) {
            if (type.parentName() != null) {
                sb.append("  ").append(sanitize(type.parentName())).append(" <|-- ").append(sanitize(type.name())).append('\n');
            } else if (type.marker() != null) {
                sb.append("  ").append(sanitize(type.marker())).append(" <|.. ").append(sanitize(type.name())).append('\n');
            }
        }
    }

    private String sanitize(String name) {
        return name.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }
}
