package io.reviewmind.cli;

import io.reviewmind.core.config.model.ReviewMindConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "status", description = "Show configuration and memory status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    ConfigOption config;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path configPath = context.resolveConfigPath(config.path);
            ReviewMindConfig loaded = context.loadConfig(config.path);
            Path memory = context.memoryPath(loaded);
            System.out.println("Config path: " + configPath);
            System.out.println("Config exists: " + Files.exists(configPath));
            System.out.println("Memory path: " + memory);
            System.out.println("Memory snapshot exists: " + Files.exists(memory.resolve("metadata.json")));
            System.out.println("Dimension: " + loaded.memory().dimension());
            System.out.println("Embedding provider: " + loaded.embedding().provider() + " (" + loaded.embedding().model() + ")");
            System.out.println("Generation provider: " + loaded.generation().provider() + " (" + loaded.generation().model() + ")");
            System.out.println("Anthropic configured: " + loaded.providers().anthropic().configured());
            System.out.println("OpenAI configured: " + loaded.providers().openai().configured());
            System.out.println("OpenRouter configured: " + loaded.providers().openrouter().configured());
            System.out.println("Cohere configured: " + loaded.providers().cohere().configured());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
