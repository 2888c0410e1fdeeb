package io.reviewmind.core.memory;

import io.reviewmind.core.ReviewMindException;

/**
 * An embedding does not have the dimension the store was built for.
 */
public final class DimensionMismatchException extends ReviewMindException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
