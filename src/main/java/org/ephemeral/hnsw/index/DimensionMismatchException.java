package org.ephemeral.hnsw.index;

import lombok.Getter;

/**
 * Thrown when a vector or query length disagrees with the dimension the index (or the other operand)
 * was configured with.
 *
 * <p>Raised synchronously before any state is touched, so a failed {@code add} or {@code search}
 * never leaves the graph partially modified.
 */
@Getter
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;

    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch : expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
