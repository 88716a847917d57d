package com.columnhierarchy.core.renderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Where and how a renderer delivers emitted files.
 *
 * <p>The output directory is stored absolute and normalized, so {@link #resolve(String)}
 * can tell whether an emitted path stays inside it. Console-only knobs are ignored by the
 * file system renderer and vice versa.
 *
 * @param outputDirectory target directory for written files
 * @param overwrite replace files that already exist
 * @param colors highlight console headers with ANSI colors
 * @param showHeaders print a header line before each file on the console
 */
public record RenderContext(
    Path outputDirectory,
    boolean overwrite,
    boolean colors,
    boolean showHeaders
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        outputDirectory = outputDirectory.toAbsolutePath().normalize();
    }

    /**
     * Creates a context that overwrites existing files and prints plain headers.
     *
     * @param outputDirectory target directory
     * @return default context
     */
    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, true, false, true);
    }

    public static RenderContext of(String outputDirectory) {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        return of(Paths.get(outputDirectory));
    }

    public RenderContext withOverwrite(boolean overwrite) {
        return new RenderContext(outputDirectory, overwrite, colors, showHeaders);
    }

    public RenderContext withColors(boolean colors) {
        return new RenderContext(outputDirectory, overwrite, colors, showHeaders);
    }

    public RenderContext withShowHeaders(boolean showHeaders) {
        return new RenderContext(outputDirectory, overwrite, colors, showHeaders);
    }

    /**
     * Resolves an emitted file's relative path against the output directory.
     *
     * @param relativePath path of an emitted file
     * @return absolute target path
     * @throws IllegalStateException if the path leaves the output directory
     */
    public Path resolve(String relativePath) {
        Path target = outputDirectory.resolve(relativePath).normalize();
        if (!target.startsWith(outputDirectory)) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + relativePath);
        }
        return target;
    }
}
