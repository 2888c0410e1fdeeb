package io.reviewmind.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reviewmind.core.external.ExternalCallException;
import io.reviewmind.core.external.JsonHttpCaller;
import io.reviewmind.core.model.ChatMessage;
import io.reviewmind.core.model.MessageRole;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Provider for OpenAI-compatible {@code /chat/completions} APIs (OpenAI, OpenRouter and
 * self-hosted gateways).
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final Map<String, String> extraHeaders;
    private final JsonHttpCaller caller;
    private final ObjectMapper mapper;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, Duration.ofSeconds(30), 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        Duration timeout,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.caller = new JsonHttpCaller(name, timeout, maxAttempts);
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, GenerationOptions options) {
        if (apiKey.isBlank()) {
            throw new ExternalCallException("missing API key for provider " + name);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("max_tokens", options.maxTokens());
        payload.put("temperature", options.temperature());

        Map<String, String> headers = new LinkedHashMap<>(extraHeaders);
        headers.put("Authorization", "Bearer " + apiKey);

        JsonNode root = caller.post(
            apiBase.newBuilder().addPathSegment("chat").addPathSegment("completions").build(),
            headers,
            payload
        );
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        Map<String, Object> usage = root.has("usage")
            ? mapper.convertValue(root.path("usage"), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new LlmResponse(content.trim(), usage);
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }
}
