package io.reviewmind.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import io.reviewmind.core.external.ExternalCallException;
import io.reviewmind.core.external.JsonHttpCaller;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Client for the Cohere {@code /embed} endpoint. Texts are embedded as search documents.
 */
public final class CohereEmbeddingClient implements EmbeddingClient {
    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final JsonHttpCaller caller;

    public CohereEmbeddingClient(String apiKey, String apiBase, String model, Duration timeout, int maxAttempts) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.caller = new JsonHttpCaller("cohere-embeddings", timeout, maxAttempts);
    }

    @Override
    public String name() {
        return "cohere";
    }

    @Override
    public float[] embed(String text) {
        if (apiKey.isBlank()) {
            throw new ExternalCallException("cohere-embeddings: missing API key");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("texts", List.of(text == null ? "" : text));
        payload.put("model", model);
        payload.put("input_type", "search_document");

        JsonNode root = caller.post(
            apiBase.newBuilder().addPathSegment("embed").build(),
            Map.of("Authorization", "Bearer " + apiKey),
            payload
        );
        return Vectors.fromJson(root.path("embeddings").path(0), "cohere-embeddings");
    }
}
