package io.reviewmind.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reviewmind.core.config.ConfigService;
import io.reviewmind.core.config.model.ReviewMindConfig;
import io.reviewmind.core.embedding.EmbeddingClient;
import io.reviewmind.core.embedding.HashingEmbeddingClient;
import io.reviewmind.core.suggestion.CommentGenerator;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ReviewCommandIntegrationTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private CliContext context;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "memory": { "path": "%s", "dimension": 64 },
              "embedding": { "provider": "hashing", "parallelism": 2 }
            }
            """.formatted(tempDir.resolve("memory").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
        context = new CliContext(new ConfigService(), configPath, new StubComponents("Guard against a null amount."));
    }

    @Test
    void shouldIngestReviewsAndSuggestCommentsForSimilarChange() throws Exception {
        Path event = tempDir.resolve("event.json");
        Files.writeString(event, """
            {
              "repository": "acme/payments",
              "pull_request_id": 12,
              "pr_title": "Add charge endpoint",
              "files": [
                {
                  "filename": "src/PaymentController.java",
                  "patch": "@@ -1,1 +1,3 @@\\n class PaymentController {\\n+  void charge(Amount amount) { gateway.charge(amount.value()); }\\n+}"
                }
              ],
              "comments": [
                {
                  "user": "alice",
                  "body": "Add a null check before using amount",
                  "path": "src/PaymentController.java",
                  "line": 2,
                  "created_at": "2024-05-01T10:15:30Z"
                }
              ]
            }
            """, StandardCharsets.UTF_8);

        String ingestOut = run(new IngestCommand(context), event.toString());
        assertThat(ingestOut).contains("Added 1 memories, skipped 0 unit(s)").contains("Memory size: 1");

        Path change = tempDir.resolve("change.json");
        Files.writeString(change, """
            {
              "repository": "acme/payments",
              "pr_number": 13,
              "title": "Add refund endpoint",
              "files": [
                {
                  "path": "src/RefundController.java",
                  "added_lines": [
                    { "lineNumber": 7, "text": "  void charge(Amount amount) { gateway.charge(amount.value()); }" },
                    { "lineNumber": 8, "text": "}" }
                  ]
                }
              ]
            }
            """, StandardCharsets.UTF_8);
        Path output = tempDir.resolve("generated_review.json");

        String reviewOut = run(new ReviewCommand(context), change.toString(), "--output", output.toString(), "--print");

        assertThat(reviewOut)
            .contains("Generated 1 suggestion(s) for 1 chunk(s) (threshold 0.20, memory 1)")
            .contains("**File: `src/RefundController.java`** (line ~7)")
            .contains("Guard against a null amount.");
        JsonNode root = new ObjectMapper().readTree(Files.readString(output));
        assertThat(root.path("pr_number").asLong()).isEqualTo(13);
        JsonNode comment = root.path("comments").path(0);
        assertThat(comment.path("file").asText()).isEqualTo("src/RefundController.java");
        assertThat(comment.path("line").asInt()).isEqualTo(7);
        assertThat(comment.path("comment").asText())
            .startsWith("Guard against a null amount.")
            .contains("by @alice (similarity: 100%)")
            .contains("📋 Related areas: validation");

        String statsOut = run(new StatsCommand(context));
        assertThat(statsOut).contains("Entries: 1").contains("Dimension: 64").contains("validation: 1");
    }

    @Test
    void shouldReportEmptyMemoryWithoutFailing() throws Exception {
        Path change = tempDir.resolve("change.json");
        Files.writeString(change, """
            { "pr_number": 1, "files": [ { "path": "A.java", "added_lines": [ { "lineNumber": 1, "text": "x" } ] } ] }
            """, StandardCharsets.UTF_8);

        String out = run(new ReviewCommand(context), change.toString(), "--output", tempDir.resolve("out.json").toString());

        assertThat(out).contains("Memory is empty; run ingest first").contains("Generated 0 suggestion(s)");
        assertThat(Files.exists(tempDir.resolve("out.json"))).isTrue();
    }

    @Test
    void shouldFailWithMessageWhenEventFileIsMissing() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = new CommandLine(new IngestCommand(context)).execute(tempDir.resolve("nope.json").toString());
        } finally {
            System.setErr(originalErr);
        }

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Ingest failed: File not found");
    }

    @Test
    void initAndStatusShouldDescribeConfiguration() {
        String initOut = run(new InitCommand(context));
        String statusOut = run(new StatusCommand(context));

        assertThat(initOut)
            .contains("Refreshed config with new defaults: " + configPath)
            .contains("Memory directory ready: " + tempDir.resolve("memory"));
        assertThat(Files.isDirectory(tempDir.resolve("memory"))).isTrue();
        assertThat(statusOut)
            .contains("Config exists: true")
            .contains("Dimension: 64")
            .contains("Embedding provider: hashing")
            .contains("Anthropic configured: false");
    }

    private static String run(Object command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        assertThat(code).as("exit code, output: %s", out).isEqualTo(0);
        return out.toString(StandardCharsets.UTF_8);
    }

    private record StubComponents(String reply) implements ComponentFactory {
        @Override
        public EmbeddingClient embeddings(ReviewMindConfig config) {
            return new HashingEmbeddingClient(config.memory().dimension());
        }

        @Override
        public CommentGenerator generator(ReviewMindConfig config) {
            return context -> reply;
        }
    }
}
