package io.reviewmind.core.embedding;

/**
 * Computes embeddings for code and comment text. Identical text is expected to map to
 * (nearly) identical vectors. Remote implementations throw
 * {@link io.reviewmind.core.external.ExternalCallException} on failure.
 */
public interface EmbeddingClient {
    String name();

    float[] embed(String text);
}
