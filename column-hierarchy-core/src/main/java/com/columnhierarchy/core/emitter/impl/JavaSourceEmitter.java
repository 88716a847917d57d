package com.columnhierarchy.core.emitter.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.emitter.EmitterConfig;
import com.columnhierarchy.core.emitter.TypeEmitter;
import com.columnhierarchy.core.model.TypeDescriptor;
import com.columnhierarchy.core.util.JavaIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Emits one Java source file per type.
 *
 * <p>Derived types extend their parent; root types implement the capability marker, for
 * which an empty marker interface is emitted as well. Every own field becomes a public
 * field of the configured uniform type ({@code String} by default).
 *
 * <p><b>Example output:</b>
 * <pre>{@code
 * package com.example.generated;
 *
 * public class ColumnSubset3 extends ColumnSubset1 {
 *     public String DateDeleted;
 * }
 * }</pre>
 *
 * <p>Names that are not legal identifiers are rewritten with {@link JavaIdentifiers} and
 * the original column name is kept in a trailing comment. Field identifiers are unique
 * along each emitted inheritance chain: when two columns map to the same identifier, or a
 * column maps to one an ancestor already declares, the later one gets a {@code _2},
 * {@code _3}, ... suffix. Fields of registry parents outside the emitted batch are unknown
 * and not considered.
 */
public class JavaSourceEmitter implements TypeEmitter {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceEmitter.class);

    private static final String EMITTER_ID = "java";
    private static final String DISPLAY_NAME = "Java Source Emitter";
    private static final String FILE_EXTENSION = "java";
    private static final String CONTENT_TYPE = "text/x-java-source";
    private static final String INDENT = "    ";

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

        List<EmittedFile> files = new ArrayList<>();
        Set<String> markers = new LinkedHashSet<>();
        for (TypeDescriptor type : types) {
            if (type.marker() != null) {
                markers.add(type.marker());
            }
        }
        for (String marker : markers) {
            files.add(sourceFile(config, marker, renderMarker(config, marker)));
        }
        Map<String, TypeDescriptor> byName = new HashMap<>();
        for (TypeDescriptor type : types) {
            byName.put(type.name(), type);
        }
        Map<String, Map<String, String>> fieldIdentifiers = new HashMap<>();
        for (TypeDescriptor type : types) {
            Map<String, String> identifiers = fieldIdentifiers(type, byName, fieldIdentifiers);
            files.add(sourceFile(config, type.name(), renderClass(config, type, identifiers)));
        }

        log.debug("Emitted {} Java source files ({} marker interfaces)", files.size(), markers.size());
        return new EmittedOutput(files);
    }

    private EmittedFile sourceFile(EmitterConfig config, String typeName, String content) {
        String fileName = JavaIdentifiers.toIdentifier(typeName) + "." + FILE_EXTENSION;
        String directory = config.packageName() == null ? "" : config.packageName().replace('.', '/') + "/";
        return new EmittedFile(directory + fileName, content, CONTENT_TYPE);
    }

    private String renderMarker(EmitterConfig config, String marker) {
        StringBuilder sb = new StringBuilder();
        appendPackage(sb, config);
        sb.append("public interface ").append(JavaIdentifiers.toIdentifier(marker)).append(" {\n");
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Maps each own field of a type to its identifier, avoiding every identifier already
     * used by the type's emitted ancestors. Results are memoized per type name.
     */
    private Map<String, String> fieldIdentifiers(TypeDescriptor type, Map<String, TypeDescriptor> byName,
                                                 Map<String, Map<String, String>> memo) {
        Deque<TypeDescriptor> chain = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        for (TypeDescriptor t = type; t != null; t = parentOf(t, byName)) {
            if (!seen.add(t.name())) {
                throw new IllegalStateException("Inheritance cycle at type " + t.name());
            }
            chain.push(t);
        }

        Set<String> used = new HashSet<>();
        Map<String, String> identifiers = Map.of();
        while (!chain.isEmpty()) {
            TypeDescriptor current = chain.pop();
            identifiers = memo.get(current.name());
            if (identifiers == null) {
                identifiers = assignIdentifiers(current, used);
                memo.put(current.name(), identifiers);
            }
            used.addAll(identifiers.values());
        }
        return identifiers;
    }

    private Map<String, String> assignIdentifiers(TypeDescriptor type, Set<String> inherited) {
        Set<String> used = new HashSet<>(inherited);
        Map<String, String> identifiers = new LinkedHashMap<>();
        for (String field : type.ownFields()) {
            String base = JavaIdentifiers.toIdentifier(field);
            String identifier = base;
            for (int n = 2; used.contains(identifier); n++) {
                identifier = base + "_" + n;
            }
            if (!identifier.equals(base)) {
                log.debug("Column {} of {} renamed to {} to avoid a clash", field, type.name(), identifier);
            }
            used.add(identifier);
            identifiers.put(field, identifier);
        }
        return identifiers;
    }

    private TypeDescriptor parentOf(TypeDescriptor type, Map<String, TypeDescriptor> byName) {
        return type.parentName() == null ? null : byName.get(type.parentName());
    }

    private String renderClass(EmitterConfig config, TypeDescriptor type, Map<String, String> identifiers) {
        StringBuilder sb = new StringBuilder();
        appendPackage(sb, config);

        sb.append("public class ").append(JavaIdentifiers.toIdentifier(type.name()));
        if (type.parentName() != null) {
            sb.append(" extends ").append(JavaIdentifiers.toIdentifier(type.parentName()));
        } else if (type.marker() != null) {
            sb.append(" implements ").append(JavaIdentifiers.toIdentifier(type.marker()));
        }
        sb.append(" {\n");

        for (String field : type.ownFields()) {
            String identifier = identifiers.get(field);
            sb.append(INDENT).append("public ").append(config.fieldType()).append(' ').append(identifier).append(';');
            if (!identifier.equals(field)) {
                sb.append(" // column: ").append(field);
            }
            sb.append('\n');
        }

        sb.append("}\n");
        return sb.toString();
    }

    private void appendPackage(StringBuilder sb, EmitterConfig config) {
        if (config.packageName() != null) {
            sb.append("package ").append(config.packageName()).append(";\n\n");
        }
    }
}
