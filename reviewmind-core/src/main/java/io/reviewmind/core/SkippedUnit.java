package io.reviewmind.core;

/**
 * A unit of work (chunk or comment) left out of a pass, with the reason it was dropped.
 */
public record SkippedUnit(String filePath, int startLine, int endLine, String reason) {
    public SkippedUnit {
        filePath = filePath == null ? "" : filePath;
        reason = reason == null ? "" : reason;
    }

    public String location() {
        return startLine == endLine ? filePath + ":" + startLine : filePath + ":" + startLine + "-" + endLine;
    }
}
