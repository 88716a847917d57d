package com.columnhierarchy.core.renderer;

import com.columnhierarchy.core.emitter.EmittedOutput;

/**
 * Destination for emitted files: a directory, the console, or anything else.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). Register
 * implementations in {@code META-INF/services/com.columnhierarchy.core.renderer.OutputRenderer}.
 *
 * @see EmittedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lowercase renderer identifier (e.g. "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Writes every emitted file to this renderer's destination.
     *
     * @param output emitted files
     * @param context output directory and renderer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(EmittedOutput output, RenderContext context);
}
