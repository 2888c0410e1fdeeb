package io.reviewmind.core.suggestion;

/**
 * Natural-language synthesis of a review comment. Implementations call out to a
 * generation model and throw {@link io.reviewmind.core.external.ExternalCallException}
 * when the call fails.
 */
public interface CommentGenerator {
    String NO_REVIEW_NEEDED = "NO_REVIEW_NEEDED";

    String generate(GenerationContext context);
}
