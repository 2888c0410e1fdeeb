package io.reviewmind.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import io.reviewmind.core.external.ExternalCallException;
import io.reviewmind.core.external.JsonHttpCaller;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Client for OpenAI-compatible {@code /embeddings} endpoints.
 */
public final class OpenAiEmbeddingClient implements EmbeddingClient {
    private static final int MAX_INPUT_CHARS = 8000;

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final int dimensions;
    private final JsonHttpCaller caller;

    /**
     * @param dimensions requested output size, or {@code 0} for the model's native size
     */
    public OpenAiEmbeddingClient(String apiKey, String apiBase, String model, int dimensions, Duration timeout, int maxAttempts) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.dimensions = Math.max(0, dimensions);
        this.caller = new JsonHttpCaller("openai-embeddings", timeout, maxAttempts);
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public float[] embed(String text) {
        if (apiKey.isBlank()) {
            throw new ExternalCallException("openai-embeddings: missing API key");
        }
        String input = text == null ? "" : text;
        if (input.length() > MAX_INPUT_CHARS) {
            input = input.substring(0, MAX_INPUT_CHARS);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", input);
        if (dimensions > 0) {
            payload.put("dimensions", dimensions);
        }

        JsonNode root = caller.post(
            apiBase.newBuilder().addPathSegment("embeddings").build(),
            Map.of("Authorization", "Bearer " + apiKey),
            payload
        );
        return Vectors.fromJson(root.path("data").path(0).path("embedding"), "openai-embeddings");
    }
}
