package io.reviewmind.core.review;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.diff.DiffChunk;
import io.reviewmind.core.suggestion.Provenance;
import io.reviewmind.core.suggestion.Suggestion;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GeneratedReviewWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteGeneratedReviewDocument() throws Exception {
        Suggestion suggestion = new Suggestion(
            new DiffChunk("Pay.java", 12, 14, "code", null),
            "Check amount.\n\n---\nfooter",
            List.of(new Provenance("alice", 0.85), new Provenance("bob", 0.5)),
            List.of("validation"),
            2
        );
        ReviewReport report = new ReviewReport(
            77,
            9,
            0.3,
            4,
            1,
            List.of(suggestion),
            "",
            List.of(new SkippedUnit("A.java", 1, 3, "embedding failed: timeout"))
        );
        Path target = tempDir.resolve("out/generated_review.json");

        new GeneratedReviewWriter().write(target, report);

        JsonNode root = new ObjectMapper().readTree(Files.readString(target));
        assertThat(root.path("pr_number").asLong()).isEqualTo(77);
        JsonNode comment = root.path("comments").path(0);
        assertThat(comment.path("file").asText()).isEqualTo("Pay.java");
        assertThat(comment.path("line").asInt()).isEqualTo(12);
        assertThat(comment.path("comment").asText()).startsWith("Check amount.");
        assertThat(comment.path("similarity_info").path(1).path("reviewer").asText()).isEqualTo("bob");
        assertThat(comment.path("similarity_info").path(0).path("similarity").asDouble()).isEqualTo(0.85);
        assertThat(root.has("summary")).isFalse();
        JsonNode metadata = root.path("metadata");
        assertThat(metadata.path("total_chunks_analyzed").asInt()).isEqualTo(4);
        assertThat(metadata.path("chunks_with_similar_reviews").asInt()).isEqualTo(1);
        assertThat(metadata.path("comments_generated").asInt()).isEqualTo(1);
        assertThat(metadata.path("memory_size").asInt()).isEqualTo(9);
        assertThat(metadata.path("skipped").path(0).path("reason").asText()).isEqualTo("embedding failed: timeout");
        assertThat(Files.exists(tempDir.resolve("out/generated_review.json.tmp"))).isFalse();
    }
}
