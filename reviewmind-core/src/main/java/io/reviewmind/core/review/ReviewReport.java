package io.reviewmind.core.review;

import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.suggestion.Suggestion;
import java.util.List;

/**
 * Outcome of one generation pass.
 *
 * @param summary summary comment text, empty unless more than one suggestion was produced
 */
public record ReviewReport(
    long pullRequestId,
    int memorySize,
    double threshold,
    int chunksAnalyzed,
    int chunksWithMatches,
    List<Suggestion> suggestions,
    String summary,
    List<SkippedUnit> skipped
) {
    public ReviewReport {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        summary = summary == null ? "" : summary;
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean hasSummary() {
        return !summary.isBlank();
    }
}
