package io.reviewmind.cli;

import io.reviewmind.core.config.model.ReviewMindConfig;
import io.reviewmind.core.embedding.EmbeddingClient;
import io.reviewmind.core.suggestion.CommentGenerator;

/**
 * Builds the external collaborators selected by the configuration.
 */
public interface ComponentFactory {
    EmbeddingClient embeddings(ReviewMindConfig config);

    CommentGenerator generator(ReviewMindConfig config);
}
