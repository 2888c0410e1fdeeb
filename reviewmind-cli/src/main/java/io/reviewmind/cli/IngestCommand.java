package io.reviewmind.cli;

import io.reviewmind.core.config.model.ReviewMindConfig;
import io.reviewmind.core.diff.DiffChunker;
import io.reviewmind.core.external.TimeBoxedCalls;
import io.reviewmind.core.ingest.CommentTagger;
import io.reviewmind.core.ingest.IngestionPipeline;
import io.reviewmind.core.ingest.IngestionResult;
import io.reviewmind.core.ingest.ReviewEvent;
import io.reviewmind.core.memory.VectorMemoryStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "ingest", description = "Add the comments of finished reviews to the memory")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Parameters(arity = "1..*", description = "Review event JSON files")
    List<Path> events;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReviewMindConfig loaded = context.loadConfig(config.path);
            Path memory = context.memoryPath(loaded);
            VectorMemoryStore store = VectorMemoryStore.load(memory, loaded.memory().dimension());

            int appended = 0;
            int skipped = 0;
            try (TimeBoxedCalls calls = new TimeBoxedCalls(
                loaded.embedding().parallelism(),
                Duration.ofSeconds(loaded.embedding().timeoutSeconds())
            )) {
                IngestionPipeline pipeline = new IngestionPipeline(
                    store,
                    context.components().embeddings(loaded),
                    new DiffChunker(loaded.chunking().maxLines()),
                    new CommentTagger(loaded.tagging()),
                    calls
                );
                for (Path eventFile : events) {
                    ReviewEvent event = JsonFiles.read(eventFile, ReviewEvent.class);
                    IngestionResult result = pipeline.ingest(event);
                    appended += result.appended().size();
                    skipped += result.skipped().size();
                    System.out.println(
                        "Ingested " + result.appended().size() + " comment(s) from " + eventFile
                            + (result.skipped().isEmpty() ? "" : ", skipped " + result.skipped().size())
                    );
                }
            }

            store.persist(memory);
            System.out.println("Added " + appended + " memories, skipped " + skipped + " unit(s)");
            System.out.println("Memory size: " + store.size());
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }
}
