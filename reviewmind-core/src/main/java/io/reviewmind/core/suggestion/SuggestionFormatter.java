package io.reviewmind.core.suggestion;

import java.util.List;

/**
 * Appends the provenance footer to generated comment text.
 */
public final class SuggestionFormatter {

    public String withFooter(String generated, int matchCount, Provenance primary, List<String> tags) {
        StringBuilder out = new StringBuilder(generated == null ? "" : generated.trim());
        out.append("\n\n---\n");
        out.append("🤖 This suggestion is based on ")
            .append(matchCount)
            .append(" similar past review(s) by @")
            .append(primary.author())
            .append(" (similarity: ")
            .append(percent(primary.score()))
            .append("%)");
        if (tags != null && !tags.isEmpty()) {
            out.append("\n📋 Related areas: ").append(String.join(", ", tags));
        }
        return out.toString();
    }

    static long percent(double score) {
        return Math.round(score * 100.0);
    }
}
