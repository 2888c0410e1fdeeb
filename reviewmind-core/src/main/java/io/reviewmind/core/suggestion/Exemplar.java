package io.reviewmind.core.suggestion;

import java.util.List;

/**
 * A past review handed to the generator as an example.
 */
public record Exemplar(String author, String comment, List<String> tags, double score, String originalCode) {
    public Exemplar {
        tags = tags == null ? List.of() : List.copyOf(tags);
        comment = comment == null ? "" : comment;
        originalCode = originalCode == null ? "" : originalCode;
    }
}
