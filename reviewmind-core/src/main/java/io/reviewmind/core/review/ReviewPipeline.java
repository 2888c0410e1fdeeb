package io.reviewmind.core.review;

import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.diff.DiffChunk;
import io.reviewmind.core.diff.DiffChunker;
import io.reviewmind.core.diff.DiffPositionResolver;
import io.reviewmind.core.diff.FileDiff;
import io.reviewmind.core.embedding.EmbeddingClient;
import io.reviewmind.core.external.TimeBoxedCalls;
import io.reviewmind.core.external.TimeBoxedCalls.Outcome;
import io.reviewmind.core.memory.DimensionMismatchException;
import io.reviewmind.core.memory.MemoryStore;
import io.reviewmind.core.memory.SearchHit;
import io.reviewmind.core.similarity.SimilarityMatch;
import io.reviewmind.core.similarity.SimilarityPolicy;
import io.reviewmind.core.suggestion.Suggestion;
import io.reviewmind.core.suggestion.SuggestionAggregator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generation pass: chunk the change, embed every chunk, look up similar past reviews,
 * keep the matches the similarity policy accepts and turn them into suggestions.
 * Failures of a single chunk, including a query of the wrong dimension, skip that chunk only.
 */
public final class ReviewPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(ReviewPipeline.class);

    private final MemoryStore store;
    private final EmbeddingClient embeddings;
    private final DiffChunker chunker;
    private final SimilarityPolicy policy;
    private final SuggestionAggregator aggregator;
    private final TimeBoxedCalls embeddingCalls;
    private final TimeBoxedCalls generationCalls;
    private final int topK;
    private final DiffPositionResolver positions = new DiffPositionResolver();
    private final SummaryFormatter summaries = new SummaryFormatter();

    public ReviewPipeline(
        MemoryStore store,
        EmbeddingClient embeddings,
        DiffChunker chunker,
        SimilarityPolicy policy,
        SuggestionAggregator aggregator,
        TimeBoxedCalls embeddingCalls,
        TimeBoxedCalls generationCalls,
        int topK
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.chunker = Objects.requireNonNull(chunker, "chunker must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.embeddingCalls = Objects.requireNonNull(embeddingCalls, "embeddingCalls must not be null");
        this.generationCalls = Objects.requireNonNull(generationCalls, "generationCalls must not be null");
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        this.topK = topK;
    }

    public ReviewReport review(ChangeRequest change, CommentSink sink) {
        Objects.requireNonNull(change, "change must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        List<DiffChunk> chunks = chunker.split(change.diffs(), change.prTitle());
        int memorySize = store.size();
        double threshold = policy.threshold(memorySize);
        if (memorySize == 0) {
            LOG.info("Memory is empty, no suggestions for {} chunk(s)", chunks.size());
            return new ReviewReport(change.pullRequestId(), 0, threshold, chunks.size(), 0, List.of(), "", List.of());
        }
        LOG.info("Reviewing {} chunk(s) against {} memories, threshold {}", chunks.size(), memorySize, threshold);

        List<SkippedUnit> skipped = new ArrayList<>();
        List<Outcome<float[]>> vectors = embeddingCalls.map(chunks, chunk -> embeddings.embed(chunk.text()));

        List<DiffChunk> matched = new ArrayList<>();
        List<List<SimilarityMatch>> acceptedByChunk = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            DiffChunk chunk = chunks.get(i);
            Outcome<float[]> vector = vectors.get(i);
            if (!vector.succeeded()) {
                LOG.warn("Skipping {}: embedding failed: {}", chunk.location(), vector.failure().getMessage());
                skipped.add(skip(chunk, "embedding failed: " + vector.failure().getMessage()));
                continue;
            }
            List<SearchHit> hits;
            try {
                hits = store.search(vector.value(), topK);
            } catch (DimensionMismatchException e) {
                LOG.warn("Skipping {}: {}", chunk.location(), e.getMessage());
                skipped.add(skip(chunk, e.getMessage()));
                continue;
            }
            List<SimilarityMatch> candidates = new ArrayList<>();
            for (SearchHit hit : hits) {
                candidates.add(SimilarityMatch.candidate(chunk, hit));
            }
            List<SimilarityMatch> accepted = new ArrayList<>();
            for (SimilarityMatch match : policy.rank(candidates, threshold)) {
                if (match.accepted()) {
                    accepted.add(match);
                }
            }
            LOG.debug("{}: {} candidate(s), {} accepted", chunk.location(), candidates.size(), accepted.size());
            if (!accepted.isEmpty()) {
                matched.add(chunk);
                acceptedByChunk.add(accepted);
            }
        }

        List<Integer> slots = new ArrayList<>();
        for (int i = 0; i < matched.size(); i++) {
            slots.add(i);
        }
        List<Outcome<Optional<Suggestion>>> generated =
            generationCalls.map(slots, slot -> aggregator.aggregate(matched.get(slot), acceptedByChunk.get(slot)));

        List<Suggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < matched.size(); i++) {
            DiffChunk chunk = matched.get(i);
            Outcome<Optional<Suggestion>> outcome = generated.get(i);
            if (!outcome.succeeded()) {
                LOG.warn("Skipping {}: generation failed: {}", chunk.location(), outcome.failure().getMessage());
                skipped.add(skip(chunk, "generation failed: " + outcome.failure().getMessage()));
                continue;
            }
            outcome.value().ifPresent(suggestions::add);
        }

        for (Suggestion suggestion : suggestions) {
            DiffChunk chunk = suggestion.chunk();
            sink.postInline(chunk.filePath(), chunk.startLine(), positionOf(change, chunk), suggestion.commentText());
        }

        String summary = "";
        if (suggestions.size() > 1) {
            summary = summaries.format(memorySize, chunks.size(), matched.size(), suggestions.size());
            sink.postGeneral(summary);
        }

        LOG.info(
            "Review of #{} done: {} chunk(s) with matches, {} suggestion(s), {} skipped",
            change.pullRequestId(),
            matched.size(),
            suggestions.size(),
            skipped.size()
        );
        return new ReviewReport(
            change.pullRequestId(),
            memorySize,
            threshold,
            chunks.size(),
            matched.size(),
            suggestions,
            summary,
            skipped
        );
    }

    private OptionalInt positionOf(ChangeRequest change, DiffChunk chunk) {
        Optional<FileDiff> diff = change.diff(chunk.filePath());
        if (diff.isEmpty() || diff.get().patch().isBlank()) {
            return OptionalInt.empty();
        }
        return positions.position(diff.get().patch(), chunk.startLine());
    }

    private SkippedUnit skip(DiffChunk chunk, String reason) {
        return new SkippedUnit(chunk.filePath(), chunk.startLine(), chunk.endLine(), reason);
    }
}
