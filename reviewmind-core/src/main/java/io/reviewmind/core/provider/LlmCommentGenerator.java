package io.reviewmind.core.provider;

import io.reviewmind.core.model.ChatMessage;
import io.reviewmind.core.suggestion.CommentGenerator;
import io.reviewmind.core.suggestion.Exemplar;
import io.reviewmind.core.suggestion.GenerationContext;
import java.util.List;
import java.util.Locale;

/**
 * Generates review comments with a chat model, using past reviews as exemplars.
 */
public final class LlmCommentGenerator implements CommentGenerator {
    private static final String SYSTEM_PROMPT = "You are a code reviewer analyzing a pull request. "
        + "You write concise, specific review comments that stay consistent with the team's earlier feedback.";

    private final LlmProvider provider;
    private final String model;
    private final GenerationOptions options;

    public LlmCommentGenerator(LlmProvider provider, String model, GenerationOptions options) {
        this.provider = provider;
        this.model = model;
        this.options = options;
    }

    @Override
    public String generate(GenerationContext context) {
        List<ChatMessage> messages = List.of(
            ChatMessage.system(SYSTEM_PROMPT),
            ChatMessage.user(buildPrompt(context))
        );
        return provider.chat(model, messages, options).content();
    }

    String buildPrompt(GenerationContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Based on similar past reviews, provide a helpful review comment for the following code change.\n\n");
        prompt.append("PR Information:\n");
        prompt.append("- Title: ").append(context.prTitle().isBlank() ? "N/A" : context.prTitle()).append('\n');
        prompt.append("- File: ").append(context.filePath()).append("\n\n");
        prompt.append("Current Code Change:\n").append(context.chunkText()).append("\n\n");

        if (!context.exemplars().isEmpty()) {
            prompt.append("Most similar past review:\n");
            appendExemplar(prompt, context.primary());
        }
        if (!context.supporting().isEmpty()) {
            prompt.append("Other similar past reviews:\n");
            for (Exemplar exemplar : context.supporting()) {
                appendExemplar(prompt, exemplar);
            }
        }
        if (!context.reviewRules().isBlank()) {
            prompt.append("Team review guidelines:\n").append(context.reviewRules().trim()).append("\n\n");
        }

        prompt.append("Generate a concise, helpful review comment for the current code change. Focus on:\n");
        prompt.append("1. Specific issues that might apply to this code\n");
        prompt.append("2. Best practices from past reviews\n");
        prompt.append("3. Consistency with previous feedback patterns\n\n");
        prompt.append("If the past reviews do not apply to the current code, answer exactly ")
            .append(NO_REVIEW_NEEDED)
            .append(".\nOtherwise answer with the review comment text only.");
        return prompt.toString();
    }

    private void appendExemplar(StringBuilder prompt, Exemplar exemplar) {
        prompt.append("Past Review (similarity: ")
            .append(String.format(Locale.ROOT, "%.2f", exemplar.score()))
            .append("):\n");
        prompt.append("Reviewer: ").append(exemplar.author()).append('\n');
        prompt.append("Tags: ").append(String.join(", ", exemplar.tags())).append('\n');
        prompt.append("Comment: ").append(exemplar.comment()).append('\n');
        prompt.append("Original code context: ").append(exemplar.originalCode()).append('\n');
        prompt.append("---\n");
    }
}
