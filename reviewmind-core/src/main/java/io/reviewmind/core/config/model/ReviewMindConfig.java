package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewMindConfig(
    MemoryConfig memory,
    ChunkingConfig chunking,
    SimilarityConfig similarity,
    TaggingConfig tagging,
    EmbeddingConfig embedding,
    GenerationConfig generation,
    ProvidersConfig providers
) {

    public static ReviewMindConfig defaults() {
        return new ReviewMindConfig(
            MemoryConfig.defaults(),
            ChunkingConfig.defaults(),
            SimilarityConfig.defaults(),
            TaggingConfig.defaults(),
            EmbeddingConfig.defaults(),
            GenerationConfig.defaults(),
            ProvidersConfig.defaults()
        );
    }

    public ReviewMindConfig withProviders(ProvidersConfig updated) {
        return new ReviewMindConfig(memory, chunking, similarity, tagging, embedding, generation, updated);
    }
}
