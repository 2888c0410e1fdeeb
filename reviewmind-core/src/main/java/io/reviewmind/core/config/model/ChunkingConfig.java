package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkingConfig(@JsonAlias({"max_lines"}) int maxLines) {

    public static ChunkingConfig defaults() {
        return new ChunkingConfig(20);
    }
}
