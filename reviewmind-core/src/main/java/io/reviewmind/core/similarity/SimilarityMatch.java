package io.reviewmind.core.similarity;

import io.reviewmind.core.diff.DiffChunk;
import io.reviewmind.core.memory.MemoryEntry;
import io.reviewmind.core.memory.SearchHit;

public record SimilarityMatch(DiffChunk chunk, MemoryEntry entry, double score, boolean accepted) {

    public static SimilarityMatch candidate(DiffChunk chunk, SearchHit hit) {
        return new SimilarityMatch(chunk, hit.entry(), hit.similarity(), false);
    }

    public SimilarityMatch withAccepted(boolean value) {
        return new SimilarityMatch(chunk, entry, score, value);
    }
}
