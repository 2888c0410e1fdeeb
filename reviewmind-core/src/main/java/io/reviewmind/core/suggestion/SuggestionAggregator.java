package io.reviewmind.core.suggestion;

import io.reviewmind.core.diff.DiffChunk;
import io.reviewmind.core.memory.MemoryEntry;
import io.reviewmind.core.similarity.SimilarityMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the accepted matches of one chunk into a single suggestion. Provenance keeps one
 * item per distinct (author, comment) pair in rank order; the generator gets the best
 * match as primary exemplar and at most {@code maxExemplars - 1} supporting ones.
 */
public final class SuggestionAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(SuggestionAggregator.class);
    private static final int ORIGINAL_CODE_PREVIEW = 200;
    private static final Comparator<SimilarityMatch> RANK_ORDER = Comparator
        .comparingDouble(SimilarityMatch::score).reversed()
        .thenComparingLong(match -> match.entry().id());

    private final CommentGenerator generator;
    private final SuggestionFormatter formatter;
    private final int maxExemplars;
    private final String reviewRules;

    public SuggestionAggregator(CommentGenerator generator, int maxExemplars) {
        this(generator, maxExemplars, "");
    }

    public SuggestionAggregator(CommentGenerator generator, int maxExemplars, String reviewRules) {
        if (generator == null) {
            throw new IllegalArgumentException("generator must not be null");
        }
        this.generator = generator;
        this.formatter = new SuggestionFormatter();
        this.maxExemplars = Math.max(1, maxExemplars);
        this.reviewRules = reviewRules == null ? "" : reviewRules;
    }

    public Optional<Suggestion> aggregate(DiffChunk chunk, List<SimilarityMatch> acceptedMatches) {
        if (acceptedMatches == null || acceptedMatches.isEmpty()) {
            return Optional.empty();
        }

        List<SimilarityMatch> ranked = new ArrayList<>(acceptedMatches);
        ranked.sort(RANK_ORDER);

        List<SimilarityMatch> distinct = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> tags = new TreeSet<>();
        for (SimilarityMatch match : ranked) {
            MemoryEntry entry = match.entry();
            tags.addAll(entry.metadata().tags());
            if (seen.add(entry.metadata().author() + '\u0000' + entry.comment())) {
                distinct.add(match);
            }
        }

        List<Provenance> provenance = new ArrayList<>(distinct.size());
        for (SimilarityMatch match : distinct) {
            provenance.add(new Provenance(match.entry().metadata().author(), match.score()));
        }

        List<Exemplar> exemplars = new ArrayList<>();
        for (SimilarityMatch match : distinct.subList(0, Math.min(maxExemplars, distinct.size()))) {
            exemplars.add(toExemplar(match));
        }

        GenerationContext context = new GenerationContext(
            chunk.context().prTitle(),
            chunk.filePath(),
            chunk.text(),
            exemplars,
            reviewRules
        );
        String generated = generator.generate(context);
        if (generated == null || generated.isBlank()
            || CommentGenerator.NO_REVIEW_NEEDED.equals(generated.trim().toUpperCase(Locale.ROOT))) {
            LOG.debug("Generator found no applicable review for {}", chunk.location());
            return Optional.empty();
        }

        List<String> tagList = List.copyOf(tags);
        String commentText = formatter.withFooter(generated, acceptedMatches.size(), provenance.get(0), tagList);
        return Optional.of(new Suggestion(chunk, commentText, provenance, tagList, acceptedMatches.size()));
    }

    private Exemplar toExemplar(SimilarityMatch match) {
        MemoryEntry entry = match.entry();
        String code = entry.snippet();
        if (code.length() > ORIGINAL_CODE_PREVIEW) {
            code = code.substring(0, ORIGINAL_CODE_PREVIEW) + "...";
        }
        return new Exemplar(
            entry.metadata().author(),
            entry.comment(),
            List.copyOf(entry.metadata().tags()),
            match.score(),
            code
        );
    }
}
