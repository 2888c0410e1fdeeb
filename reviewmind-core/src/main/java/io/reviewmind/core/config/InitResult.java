package io.reviewmind.core.config;

import java.nio.file.Path;

public record InitResult(
    Path configPath,
    Path memoryPath,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
