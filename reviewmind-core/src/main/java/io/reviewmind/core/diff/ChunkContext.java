package io.reviewmind.core.diff;

public record ChunkContext(String prTitle, String surroundingDiffSummary) {
    public ChunkContext {
        prTitle = prTitle == null ? "" : prTitle;
        surroundingDiffSummary = surroundingDiffSummary == null ? "" : surroundingDiffSummary;
    }
}
