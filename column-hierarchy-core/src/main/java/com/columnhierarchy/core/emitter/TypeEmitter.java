package com.columnhierarchy.core.emitter;

import com.columnhierarchy.core.model.TypeDescriptor;

import java.util.List;

/**
 * Backend that turns type descriptors into a physical artifact.
 *
 * <p>The resolver produces plain {@link TypeDescriptor} values and never depends on how
 * they are materialized. Emitters may write source code, schema documents, diagrams or
 * anything else a caller needs. Descriptors arrive parents first.
 *
 * <p>Emitters are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvEmitter implements TypeEmitter {
 *     @Override
 *     public String getId() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "CSV Field Listing";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public EmittedOutput emit(List<TypeDescriptor> types, EmitterConfig config) {
 *         StringBuilder sb = new StringBuilder("type,field\n");
 *         types.forEach(t -> t.ownFields().forEach(f -> sb.append(t.name()).append(',').append(f).append('\n')));
 *         return new EmittedOutput(List.of(new EmittedFile("fields.csv", sb.toString(), "text/csv")));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.columnhierarchy.core.emitter.TypeEmitter}
 *
 * @see EmitterConfig
 * @see EmittedOutput
 */
public interface TypeEmitter {

    /**
     * Returns the unique, lowercase identifier used in configuration and on the command line.
     *
     * @return emitter identifier
     */
    String getId();

    /**
     * Returns a human-readable name for listings and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the extension of the files this emitter writes, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Materializes the given types.
     *
     * <p>An empty type list yields either no files or a placeholder document.
     *
     * @param types descriptors, parents before children
     * @param config emitter settings
     * @return emitted files
     */
    EmittedOutput emit(List<TypeDescriptor> types, EmitterConfig config);
}
