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

public final class AnthropicProvider implements LlmProvider {
    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final JsonHttpCaller caller;
    private final ObjectMapper mapper;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, Duration.ofSeconds(30), 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, Duration timeout, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
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
        payload.put("max_tokens", options.maxTokens());
        payload.put("temperature", options.temperature());
        payload.put("messages", toWireMessages(messages));
        String systemPrompt = extractSystemPrompt(messages);
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }

        JsonNode root = caller.post(
            apiBase.newBuilder().addPathSegment("messages").build(),
            Map.of("x-api-key", apiKey, "anthropic-version", "2023-06-01"),
            payload
        );
        return parseResponse(root);
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    private LlmResponse parseResponse(JsonNode root) {
        StringBuilder content = new StringBuilder();
        for (JsonNode item : root.path("content")) {
            if ("text".equals(item.path("type").asText(""))) {
                content.append(item.path("text").asText(""));
            }
        }
        Map<String, Object> usage = root.has("usage")
            ? mapper.convertValue(root.path("usage"), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new LlmResponse(content.toString().trim(), usage);
    }
}
