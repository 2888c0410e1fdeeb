package io.reviewmind.core.diff;

/**
 * A bounded run of consecutive added lines in one file. Line numbers are 1-based and inclusive.
 */
public record DiffChunk(
    String filePath,
    int startLine,
    int endLine,
    String text,
    ChunkContext context
) {
    public DiffChunk {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid line range " + startLine + "-" + endLine);
        }
        filePath = filePath == null ? "" : filePath;
        text = text == null ? "" : text;
        context = context == null ? new ChunkContext("", "") : context;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public int distanceTo(int line) {
        if (contains(line)) {
            return 0;
        }
        return line < startLine ? startLine - line : line - endLine;
    }

    public String location() {
        return filePath + ":" + startLine + "-" + endLine;
    }
}
