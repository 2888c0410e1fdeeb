package io.reviewmind.cli;

import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.config.model.ReviewMindConfig;
import io.reviewmind.core.diff.DiffChunker;
import io.reviewmind.core.external.TimeBoxedCalls;
import io.reviewmind.core.memory.VectorMemoryStore;
import io.reviewmind.core.review.ChangeRequest;
import io.reviewmind.core.review.CommentSink;
import io.reviewmind.core.review.GeneratedReviewWriter;
import io.reviewmind.core.review.PrintStreamCommentSink;
import io.reviewmind.core.review.ReviewPipeline;
import io.reviewmind.core.review.ReviewReport;
import io.reviewmind.core.review.ReviewRules;
import io.reviewmind.core.similarity.SimilarityPolicy;
import io.reviewmind.core.suggestion.SuggestionAggregator;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "review", description = "Suggest review comments for a change")
public final class ReviewCommand implements Callable<Integer> {
    private static final CommentSink DISCARD = new CommentSink() {
        @Override
        public void postInline(String filePath, int line, OptionalInt position, String body) {
        }

        @Override
        public void postGeneral(String body) {
        }
    };

    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Parameters(index = "0", arity = "1", description = "Change request JSON file")
    Path change;

    @Option(names = {"-o", "--output"}, description = "Generated review file", defaultValue = GeneratedReviewWriter.DEFAULT_FILE_NAME)
    Path output;

    @Option(names = "--print", description = "Print generated comments to stdout")
    boolean print;

    public ReviewCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReviewMindConfig loaded = context.loadConfig(config.path);
            VectorMemoryStore store = VectorMemoryStore.load(context.memoryPath(loaded), loaded.memory().dimension());
            ChangeRequest request = JsonFiles.read(change, ChangeRequest.class);

            ReviewReport report;
            try (
                TimeBoxedCalls embeddingCalls = new TimeBoxedCalls(
                    loaded.embedding().parallelism(),
                    Duration.ofSeconds(loaded.embedding().timeoutSeconds())
                );
                TimeBoxedCalls generationCalls = new TimeBoxedCalls(
                    loaded.embedding().parallelism(),
                    Duration.ofSeconds(loaded.generation().timeoutSeconds())
                )
            ) {
                SuggestionAggregator aggregator = new SuggestionAggregator(
                    context.components().generator(loaded),
                    loaded.generation().maxExemplars(),
                    ReviewRules.read(loaded.generation().rulesPath())
                );
                ReviewPipeline pipeline = new ReviewPipeline(
                    store,
                    context.components().embeddings(loaded),
                    new DiffChunker(loaded.chunking().maxLines()),
                    new SimilarityPolicy(loaded.similarity()),
                    aggregator,
                    embeddingCalls,
                    generationCalls,
                    loaded.memory().topK()
                );
                report = pipeline.review(request, print ? new PrintStreamCommentSink(System.out) : DISCARD);
            }

            new GeneratedReviewWriter().write(output, report);
            if (report.memorySize() == 0) {
                System.out.println("Memory is empty; run ingest first");
            }
            System.out.println(String.format(
                Locale.ROOT,
                "Generated %d suggestion(s) for %d chunk(s) (threshold %.2f, memory %d)",
                report.suggestions().size(),
                report.chunksAnalyzed(),
                report.threshold(),
                report.memorySize()
            ));
            if (!report.skipped().isEmpty()) {
                System.out.println("Skipped units: " + report.skipped().size());
                for (SkippedUnit unit : report.skipped()) {
                    System.out.println("  " + unit.location() + ": " + unit.reason());
                }
            }
            System.out.println("Wrote " + output);
            return 0;
        } catch (Exception e) {
            System.err.println("Review failed: " + e.getMessage());
            return 1;
        }
    }
}
