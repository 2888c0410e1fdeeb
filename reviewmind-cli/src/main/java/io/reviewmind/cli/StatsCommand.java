package io.reviewmind.cli;

import io.reviewmind.core.config.model.ReviewMindConfig;
import io.reviewmind.core.memory.MemoryStats;
import io.reviewmind.core.memory.VectorMemoryStore;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "stats", description = "Show memory size and tag distribution")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    @Option(names = "--json", description = "Print stats as JSON")
    boolean json;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReviewMindConfig loaded = context.loadConfig(config.path);
            MemoryStats stats = VectorMemoryStore.load(context.memoryPath(loaded), loaded.memory().dimension()).stats();
            if (json) {
                System.out.println(JsonFiles.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(stats));
                return 0;
            }
            System.out.println("Entries: " + stats.entryCount());
            System.out.println("Dimension: " + stats.dimension());
            if (!stats.tagHistogram().isEmpty()) {
                System.out.println("Tags:");
                for (Map.Entry<String, Integer> tag : stats.tagHistogram().entrySet()) {
                    System.out.println("  " + tag.getKey() + ": " + tag.getValue());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Stats command failed: " + e.getMessage());
            return 1;
        }
    }
}
