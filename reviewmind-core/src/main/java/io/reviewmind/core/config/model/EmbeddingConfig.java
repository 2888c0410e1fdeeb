package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param provider one of {@code hashing}, {@code openai}, {@code cohere}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    String model,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    int parallelism
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("hashing", "text-embedding-3-small", 30, 4);
    }
}
