package io.reviewmind.core.suggestion;

import io.reviewmind.core.diff.DiffChunk;
import java.util.List;

/**
 * A generated review comment for one chunk, with the past reviews it is based on.
 *
 * @param commentText generated text followed by the provenance footer
 * @param provenance  contributing reviews in rank order
 * @param tags        sorted union of the contributing entries' tags
 * @param matchCount  number of accepted matches for the chunk
 */
public record Suggestion(
    DiffChunk chunk,
    String commentText,
    List<Provenance> provenance,
    List<String> tags,
    int matchCount
) {
    public Suggestion {
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public Provenance primary() {
        return provenance.get(0);
    }
}
