package com.columnhierarchy.core.emitter.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.emitter.EmitterConfig;
import com.columnhierarchy.core.emitter.TypeEmitter;
import com.columnhierarchy.core.model.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Emits a plain-text report of the hierarchy: one line per type with its own fields
 * followed by the own fields of each ancestor.
 *
 * <p><b>Example output:</b>
 * <pre>
 * ColumnSubset1: (Id,DateCreated) : IColumnSubset
 * ColumnSubset3: (DateDeleted) -&gt; (Id,DateCreated)
 * ColumnSubset5: (Name) -&gt; Base1
 * </pre>
 *
 * <p>A chain ends with {@code : marker} at a root, or with the bare parent name when the
 * parent is not among the reported types.
 */
public class HierarchyReportEmitter implements TypeEmitter {

    private static final Logger log = LoggerFactory.getLogger(HierarchyReportEmitter.class);

    private static final String EMITTER_ID = "report";
    private static final String DISPLAY_NAME = "Hierarchy Report";
    private static final String FILE_EXTENSION = "txt";
    private static final String CONTENT_TYPE = "text/plain";
    private static final String FILE_NAME = "hierarchy-report.txt";
    private static final String ARROW = " -> ";
    private static final String RULE = "-------------------------------------------\n";

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

        StringBuilder sb = new StringBuilder();
        sb.append("Type hierarchy:\n").append(RULE);
        if (types.isEmpty()) {
            sb.append("(no types)\n");
        } else {
            sb.append(format(types));
        }

        log.debug("Emitted hierarchy report for {} types", types.size());
        return new EmittedOutput(List.of(new EmittedFile(FILE_NAME, sb.toString(), CONTENT_TYPE)));
    }

    /**
     * Formats one line per type.
     *
     * @param types descriptors
     * @return report lines, each ending in a newline
     */
    public static String format(List<TypeDescriptor> types) {
        Map<String, TypeDescriptor> byName = new LinkedHashMap<>();
        types.forEach(t -> byName.put(t.name(), t));

        StringBuilder sb = new StringBuilder();
        for (TypeDescriptor type : types) {
            sb.append(describe(type, byName)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Describes one type with its ancestor chain.
     *
     * @param type type to describe
     * @param byName all known types by name
     * @return single-line description
     */
    public static String describe(TypeDescriptor type, Map<String, TypeDescriptor> byName) {
        StringBuilder sb = new StringBuilder();
        sb.append(type.name()).append(": ").append(fields(type));

        TypeDescriptor current = type;
        int depth = 0;
        while (current.parentName() != null && depth++ <= byName.size()) {
            TypeDescriptor parent = byName.get(current.parentName());
            if (parent == null) {
                sb.append(ARROW).append(current.parentName());
                return sb.toString();
            }
            sb.append(ARROW).append(fields(parent));
            current = parent;
        }
        if (current.marker() != null) {
            sb.append(" : ").append(current.marker());
        }
        return sb.toString();
    }

    private static String fields(TypeDescriptor type) {
        return "(" + String.join(",", type.ownFields()) + ")";
    }
}
