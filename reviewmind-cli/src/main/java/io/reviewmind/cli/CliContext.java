package io.reviewmind.cli;

import io.reviewmind.core.config.ConfigPaths;
import io.reviewmind.core.config.ConfigService;
import io.reviewmind.core.config.model.ReviewMindConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    ComponentFactory components
) {
    public CliContext(ConfigService configService, Path configPath, ComponentFactory components) {
        this(configService, configPath, Map.of(), components);
    }

    public ReviewMindConfig loadConfig(Path override) throws IOException {
        return configService.withEnvironment(configService.load(resolveConfigPath(override)), environment);
    }

    public Path resolveConfigPath(Path override) {
        return override != null ? override : configPath;
    }

    public Path memoryPath(ReviewMindConfig config) {
        return ConfigPaths.resolve(config.memory().path());
    }
}
