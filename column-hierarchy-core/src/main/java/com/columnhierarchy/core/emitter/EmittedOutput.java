package com.columnhierarchy.core.emitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Files produced by one or more emitters.
 *
 * @param files emitted files in emission order
 */
public record EmittedOutput(
    List<EmittedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public EmittedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static EmittedOutput empty() {
        return new EmittedOutput(List.of());
    }

    /**
     * Returns a new output holding this output's files followed by the other's.
     *
     * @param other output to append
     * @return combined output
     */
    public EmittedOutput plus(EmittedOutput other) {
        List<EmittedFile> combined = new ArrayList<>(files);
        combined.addAll(other.files());
        return new EmittedOutput(combined);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
