package io.reviewmind.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.config.model.TaggingConfig;
import io.reviewmind.core.diff.DiffChunker;
import io.reviewmind.core.diff.DiffLine;
import io.reviewmind.core.diff.FileDiff;
import io.reviewmind.core.embedding.EmbeddingClient;
import io.reviewmind.core.external.ExternalCallException;
import io.reviewmind.core.external.TimeBoxedCalls;
import io.reviewmind.core.memory.DimensionMismatchException;
import io.reviewmind.core.memory.MemoryEntry;
import io.reviewmind.core.memory.VectorMemoryStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class IngestionPipelineTest {
    private static final Instant REVIEWED_AT = Instant.parse("2024-06-01T12:00:00Z");

    private final TimeBoxedCalls calls = new TimeBoxedCalls(2, Duration.ofSeconds(5));

    @AfterEach
    void tearDown() {
        calls.close();
    }

    @Test
    void shouldAppendOneEntryPerCommentInCommentOrder() {
        VectorMemoryStore store = new VectorMemoryStore(4);
        IngestionPipeline pipeline = pipeline(store, new LengthEmbedding(4));

        IngestionResult result = pipeline.ingest(event(
            comment("alice", "Add a null check for amount", "Pay.java", 12),
            comment("bob", "This query is slow", "Pay.java", 3)
        ));

        assertThat(result.skipped()).isEmpty();
        assertThat(result.appended()).extracting(MemoryEntry::id).containsExactly(0L, 1L);
        MemoryEntry first = store.get(0);
        assertThat(first.comment()).isEqualTo("Add a null check for amount");
        assertThat(first.snippet()).isEqualTo("line 10\nline 11\nline 12");
        assertThat(first.metadata().author()).isEqualTo("alice");
        assertThat(first.metadata().repository()).isEqualTo("acme/payments");
        assertThat(first.metadata().pullRequestId()).isEqualTo(42);
        assertThat(first.metadata().lineNumber()).isEqualTo(12);
        assertThat(first.metadata().tags()).containsExactly("validation");
        assertThat(first.metadata().timestamp()).isEqualTo(REVIEWED_AT);
        assertThat(store.get(1).snippet()).isEqualTo("line 1\nline 2\nline 3");
        assertThat(store.get(1).metadata().tags()).containsExactly("performance");
    }

    @Test
    void shouldAttachCommentOutsideAddedLinesToClosestChunk() {
        VectorMemoryStore store = new VectorMemoryStore(4);

        pipeline(store, new LengthEmbedding(4)).ingest(event(comment("alice", "rename", "Pay.java", 8)));

        assertThat(store.get(0).snippet()).startsWith("line 10");
    }

    @Test
    void shouldSkipBlankCommentsAndFilesWithoutAddedLines() {
        VectorMemoryStore store = new VectorMemoryStore(4);

        IngestionResult result = pipeline(store, new LengthEmbedding(4)).ingest(event(
            comment("alice", "   ", "Pay.java", 1),
            comment("bob", "why?", "Other.java", 5)
        ));

        assertThat(result.appended()).isEmpty();
        assertThat(result.skipped()).extracting(SkippedUnit::reason)
            .containsExactly("blank comment", "no added lines in file");
        assertThat(store.size()).isZero();
    }

    @Test
    void shouldSkipCommentsWhoseEmbeddingFails() {
        VectorMemoryStore store = new VectorMemoryStore(4);
        EmbeddingClient failing = new EmbeddingClient() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public float[] embed(String text) {
                if (text.contains("line 1\n")) {
                    throw new ExternalCallException("upstream unavailable");
                }
                return new float[] {1, 2, 3, 4};
            }
        };

        IngestionResult result = pipeline(store, failing).ingest(event(
            comment("alice", "slow", "Pay.java", 2),
            comment("bob", "null check", "Pay.java", 11)
        ));

        assertThat(result.appended()).hasSize(1);
        assertThat(result.skipped()).singleElement().satisfies(unit -> {
            assertThat(unit.location()).isEqualTo("Pay.java:1-3");
            assertThat(unit.reason()).contains("upstream unavailable");
        });
        assertThat(store.get(0).metadata().author()).isEqualTo("bob");
    }

    @Test
    void shouldAbortWhenFirstEmbeddingDoesNotFitEmptyStore() {
        VectorMemoryStore store = new VectorMemoryStore(384);
        IngestionPipeline pipeline = pipeline(store, new LengthEmbedding(300));

        assertThatThrownBy(() -> pipeline.ingest(event(comment("alice", "null check", "Pay.java", 2))))
            .isInstanceOf(DimensionMismatchException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void shouldSkipMismatchedEmbeddingOnceStoreHasEntries() {
        VectorMemoryStore store = new VectorMemoryStore(4);
        pipeline(store, new LengthEmbedding(4)).ingest(event(comment("alice", "null check", "Pay.java", 2)));

        IngestionResult result = pipeline(store, new LengthEmbedding(3))
            .ingest(event(comment("bob", "null check", "Pay.java", 11)));

        assertThat(result.appended()).isEmpty();
        assertThat(result.skipped()).hasSize(1);
        assertThat(store.size()).isEqualTo(1);
    }

    private IngestionPipeline pipeline(VectorMemoryStore store, EmbeddingClient embeddings) {
        return new IngestionPipeline(store, embeddings, new DiffChunker(), new CommentTagger(TaggingConfig.defaults()), calls);
    }

    private static ReviewEvent event(ReviewComment... comments) {
        List<DiffLine> lines = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            lines.add(new DiffLine(i, "line " + i));
        }
        for (int i = 10; i <= 12; i++) {
            lines.add(new DiffLine(i, "line " + i));
        }
        return new ReviewEvent("acme/payments", 42, "Add payments", List.of(FileDiff.of("Pay.java", lines)), List.of(comments));
    }

    private static ReviewComment comment(String author, String body, String file, int line) {
        return new ReviewComment(author, body, file, line, REVIEWED_AT);
    }

    private record LengthEmbedding(int dimension) implements EmbeddingClient {
        @Override
        public String name() {
            return "length";
        }

        @Override
        public float[] embed(String text) {
            float[] vector = new float[dimension];
            vector[0] = text.length();
            return vector;
        }
    }
}
