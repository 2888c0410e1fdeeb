package io.reviewmind.core.suggestion;

import java.util.List;

/**
 * Everything the generator sees for one chunk. {@code exemplars} starts with the
 * primary exemplar (the best-ranked match) followed by supporting ones.
 */
public record GenerationContext(
    String prTitle,
    String filePath,
    String chunkText,
    List<Exemplar> exemplars,
    String reviewRules
) {
    public GenerationContext {
        prTitle = prTitle == null ? "" : prTitle;
        filePath = filePath == null ? "" : filePath;
        chunkText = chunkText == null ? "" : chunkText;
        exemplars = exemplars == null ? List.of() : List.copyOf(exemplars);
        reviewRules = reviewRules == null ? "" : reviewRules;
    }

    public Exemplar primary() {
        return exemplars.get(0);
    }

    public List<Exemplar> supporting() {
        return exemplars.size() <= 1 ? List.of() : exemplars.subList(1, exemplars.size());
    }
}
