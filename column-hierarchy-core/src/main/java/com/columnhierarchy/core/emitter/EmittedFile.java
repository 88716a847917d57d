package com.columnhierarchy.core.emitter;

import java.util.Objects;

/**
 * One file produced by an emitter.
 *
 * @param relativePath path relative to the output directory, using {@code /} separators
 * @param content file content
 * @param contentType media type of the content, e.g. {@code text/x-java-source}
 */
public record EmittedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public EmittedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
