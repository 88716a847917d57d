package com.columnhierarchy.core.util;

/**
 * Explicit, per-run allocator of consecutive integer identifiers.
 *
 * <p>Each resolution run creates its own sequence, so identifiers (and the type names
 * derived from them) are reproducible for a given input. Not thread-safe; a sequence
 * belongs to one run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * IdSequence ids = IdSequence.startingAt(1);
 * int first = ids.next();   // 1
 * int second = ids.next();  // 2
 * }</pre>
 */
public final class IdSequence {

    private int next;

    private IdSequence(int first) {
        this.next = first;
    }

    /**
     * Creates a sequence whose first identifier is {@code first}.
     *
     * @param first first identifier to hand out
     * @return new sequence
     * @throws IllegalArgumentException if first is negative
     */
    public static IdSequence startingAt(int first) {
        if (first < 0) {
            throw new IllegalArgumentException("First id must not be negative: " + first);
        }
        return new IdSequence(first);
    }

    /**
     * Returns the next identifier and advances the sequence.
     *
     * @return next identifier
     * @throws IllegalStateException if the sequence is exhausted
     */
    public int next() {
        if (next == Integer.MAX_VALUE) {
            throw new IllegalStateException("Id sequence exhausted");
        }
        return next++;
    }

    /**
     * Returns the identifier the next call to {@link #next()} will return.
     *
     * @return upcoming identifier
     */
    public int peek() {
        return next;
    }
}
