package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param path      snapshot directory
 * @param dimension embedding dimension of this deployment; {@code 0} adopts the first stored embedding's
 * @param topK      neighbours fetched per chunk
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(
    String path,
    int dimension,
    @JsonAlias({"top_k"}) int topK
) {

    public static MemoryConfig defaults() {
        return new MemoryConfig("~/.reviewmind/memory", 384, 3);
    }
}
