package io.reviewmind.core.diff;

/**
 * An added line of a change, addressed by its 1-based line number in the new file.
 */
public record DiffLine(int lineNumber, String text) {
    public DiffLine {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1");
        }
        text = text == null ? "" : text;
    }
}
