package io.reviewmind.core.suggestion;

import static org.assertj.core.api.Assertions.assertThat;

import io.reviewmind.core.diff.ChunkContext;
import io.reviewmind.core.diff.DiffChunk;
import io.reviewmind.core.memory.EntryMetadata;
import io.reviewmind.core.memory.MemoryEntry;
import io.reviewmind.core.similarity.SimilarityMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SuggestionAggregatorTest {
    private static final DiffChunk CHUNK = new DiffChunk(
        "src/PaymentController.java",
        12,
        14,
        "if (amount > 0) {\n  charge(amount);\n}",
        new ChunkContext("Add payment endpoint", "src/PaymentController.java: lines 12-14 of 3 added line(s)")
    );

    @Test
    void shouldFormatFooterWithPrimaryProvenance() {
        RecordingGenerator generator = new RecordingGenerator("Validate the amount before charging.");
        SuggestionAggregator aggregator = new SuggestionAggregator(generator, 3);
        List<SimilarityMatch> accepted = List.of(
            match(0, "alice", "Add a null check on amount", 0.85, "validation"),
            match(1, "bob", "Check negative values", 0.6, "validation"),
            match(2, "carol", "Validate request input", 0.4, "validation")
        );

        Optional<Suggestion> suggestion = aggregator.aggregate(CHUNK, accepted);

        assertThat(suggestion).isPresent();
        assertThat(suggestion.get().matchCount()).isEqualTo(3);
        assertThat(suggestion.get().tags()).containsExactly("validation");
        assertThat(suggestion.get().commentText()).isEqualTo(
            "Validate the amount before charging.\n\n---\n"
                + "🤖 This suggestion is based on 3 similar past review(s) by @alice (similarity: 85%)\n"
                + "📋 Related areas: validation"
        );
    }

    @Test
    void shouldPassPrimaryAndSupportingExemplarsToGenerator() {
        RecordingGenerator generator = new RecordingGenerator("ok");
        SuggestionAggregator aggregator = new SuggestionAggregator(generator, 2, "Prefer guard clauses.");

        aggregator.aggregate(CHUNK, List.of(
            match(5, "dave", "third", 0.3, "style"),
            match(3, "alice", "first", 0.9, "validation"),
            match(4, "bob", "second", 0.7, "security")
        ));

        GenerationContext context = generator.contexts.get(0);
        assertThat(context.prTitle()).isEqualTo("Add payment endpoint");
        assertThat(context.filePath()).isEqualTo("src/PaymentController.java");
        assertThat(context.chunkText()).isEqualTo(CHUNK.text());
        assertThat(context.primary().comment()).isEqualTo("first");
        assertThat(context.supporting()).extracting(Exemplar::comment).containsExactly("second");
        assertThat(context.reviewRules()).isEqualTo("Prefer guard clauses.");
    }

    @Test
    void shouldDropRepeatedAuthorCommentPairsFromProvenance() {
        SuggestionAggregator aggregator = new SuggestionAggregator(new RecordingGenerator("ok"), 3);

        Suggestion suggestion = aggregator.aggregate(CHUNK, List.of(
            match(0, "alice", "Add a null check", 0.8, "validation"),
            match(1, "alice", "Add a null check", 0.7, "security"),
            match(2, "bob", "Add a null check", 0.6, "style")
        )).orElseThrow();

        assertThat(suggestion.provenance()).extracting(Provenance::author).containsExactly("alice", "bob");
        assertThat(suggestion.matchCount()).isEqualTo(3);
        assertThat(suggestion.tags()).containsExactly("security", "style", "validation");
    }

    @Test
    void shouldReturnEmptyWithoutCallingGeneratorWhenNothingAccepted() {
        RecordingGenerator generator = new RecordingGenerator("unused");

        Optional<Suggestion> suggestion = new SuggestionAggregator(generator, 3).aggregate(CHUNK, List.of());

        assertThat(suggestion).isEmpty();
        assertThat(generator.contexts).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenGeneratorFindsNothingToSay() {
        List<SimilarityMatch> accepted = List.of(match(0, "alice", "Add a null check", 0.8, "validation"));

        assertThat(new SuggestionAggregator(new RecordingGenerator(" NO_REVIEW_NEEDED \n"), 3).aggregate(CHUNK, accepted))
            .isEmpty();
        assertThat(new SuggestionAggregator(new RecordingGenerator("  "), 3).aggregate(CHUNK, accepted)).isEmpty();
    }

    @Test
    void shouldTruncateLongOriginalCodeInExemplars() {
        RecordingGenerator generator = new RecordingGenerator("ok");
        EntryMetadata metadata = new EntryMetadata("r", 1, "a.java", 1, "alice", Set.of("general"), null);
        MemoryEntry entry = new MemoryEntry(0, null, new float[] {1f}, "x".repeat(500), "c", metadata);

        new SuggestionAggregator(generator, 3).aggregate(CHUNK, List.of(new SimilarityMatch(CHUNK, entry, 0.5, true)));

        assertThat(generator.contexts.get(0).primary().originalCode()).hasSize(203).endsWith("...");
    }

    @Test
    void shouldOmitRelatedAreasWithoutTags() {
        String text = new SuggestionFormatter().withFooter("Looks risky.", 1, new Provenance("bob", 0.333), List.of());

        assertThat(text).endsWith("by @bob (similarity: 33%)").doesNotContain("Related areas");
    }

    private static SimilarityMatch match(long id, String author, String comment, double score, String tag) {
        EntryMetadata metadata = new EntryMetadata("acme/payments", 7, "src/Old.java", 3, author, Set.of(tag), null);
        MemoryEntry entry = new MemoryEntry(id, null, new float[] {0f}, "old code", comment, metadata);
        return new SimilarityMatch(CHUNK, entry, score, true);
    }

    private static final class RecordingGenerator implements CommentGenerator {
        private final String reply;
        private final List<GenerationContext> contexts = new ArrayList<>();

        private RecordingGenerator(String reply) {
            this.reply = reply;
        }

        @Override
        public String generate(GenerationContext context) {
            contexts.add(context);
            return reply;
        }
    }
}
