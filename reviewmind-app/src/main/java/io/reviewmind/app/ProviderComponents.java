package io.reviewmind.app;

import io.reviewmind.cli.ComponentFactory;
import io.reviewmind.core.config.model.EmbeddingConfig;
import io.reviewmind.core.config.model.GenerationConfig;
import io.reviewmind.core.config.model.ProviderConfig;
import io.reviewmind.core.config.model.ReviewMindConfig;
import io.reviewmind.core.embedding.CohereEmbeddingClient;
import io.reviewmind.core.embedding.EmbeddingClient;
import io.reviewmind.core.embedding.HashingEmbeddingClient;
import io.reviewmind.core.embedding.OpenAiEmbeddingClient;
import io.reviewmind.core.provider.AnthropicProvider;
import io.reviewmind.core.provider.DisabledProvider;
import io.reviewmind.core.provider.FallbackLlmProvider;
import io.reviewmind.core.provider.GenerationOptions;
import io.reviewmind.core.provider.LlmCommentGenerator;
import io.reviewmind.core.provider.LlmProvider;
import io.reviewmind.core.provider.OpenAiCompatProvider;
import io.reviewmind.core.provider.ProviderRegistry;
import io.reviewmind.core.suggestion.CommentGenerator;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

final class ProviderComponents implements ComponentFactory {
    static final String OPENAI_BASE = "https://api.openai.com/v1";
    static final String OPENROUTER_BASE = "https://openrouter.ai/api/v1";
    static final String ANTHROPIC_BASE = "https://api.anthropic.com/v1";
    static final String COHERE_BASE = "https://api.cohere.ai/v1";
    private static final int MAX_ATTEMPTS = 3;
    private static final int FALLBACK_DIMENSION = 384;

    @Override
    public EmbeddingClient embeddings(ReviewMindConfig config) {
        EmbeddingConfig embedding = config.embedding();
        Duration timeout = Duration.ofSeconds(embedding.timeoutSeconds());
        int dimension = config.memory().dimension();
        String provider = embedding.provider() == null ? "hashing" : embedding.provider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingClient(dimension > 0 ? dimension : FALLBACK_DIMENSION);
            case "openai" -> new OpenAiEmbeddingClient(
                config.providers().openai().apiKey(),
                config.providers().openai().apiBaseOr(OPENAI_BASE),
                embedding.model(),
                dimension,
                timeout,
                MAX_ATTEMPTS
            );
            case "cohere" -> new CohereEmbeddingClient(
                config.providers().cohere().apiKey(),
                config.providers().cohere().apiBaseOr(COHERE_BASE),
                embedding.model(),
                timeout,
                MAX_ATTEMPTS
            );
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + embedding.provider());
        };
    }

    @Override
    public CommentGenerator generator(ReviewMindConfig config) {
        GenerationConfig generation = config.generation();
        Duration timeout = Duration.ofSeconds(generation.timeoutSeconds());

        LlmProvider anthropic = buildAnthropicProvider(config.providers().anthropic(), timeout);
        LlmProvider openai = buildOpenAiCompatProvider("openai", config.providers().openai(), OPENAI_BASE, timeout);
        LlmProvider openrouter = buildOpenAiCompatProvider("openrouter", config.providers().openrouter(), OPENROUTER_BASE, timeout);

        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new FallbackLlmProvider("anthropic", List.of(anthropic, openrouter, openai)));
        registry.register(new FallbackLlmProvider("openai", List.of(openai, openrouter, anthropic)));
        registry.register(new FallbackLlmProvider("openrouter", List.of(openrouter, openai, anthropic)));

        return new LlmCommentGenerator(
            registry.require(generation.provider()),
            generation.model(),
            new GenerationOptions(generation.maxTokens(), generation.temperature())
        );
    }

    private static LlmProvider buildOpenAiCompatProvider(
        String name,
        ProviderConfig providerConfig,
        String defaultBase,
        Duration timeout
    ) {
        if (providerConfig != null && providerConfig.configured()) {
            return new OpenAiCompatProvider(
                name,
                providerConfig.apiKey(),
                providerConfig.apiBaseOr(defaultBase),
                providerConfig.extraHeaders(),
                timeout,
                MAX_ATTEMPTS
            );
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static LlmProvider buildAnthropicProvider(ProviderConfig providerConfig, Duration timeout) {
        if (providerConfig != null && providerConfig.configured()) {
            return new AnthropicProvider(
                "anthropic",
                providerConfig.apiKey(),
                providerConfig.apiBaseOr(ANTHROPIC_BASE),
                timeout,
                MAX_ATTEMPTS
            );
        }
        return new DisabledProvider("anthropic", "missing API key");
    }
}
