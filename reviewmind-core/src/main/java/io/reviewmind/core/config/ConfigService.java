package io.reviewmind.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.reviewmind.core.config.model.ProviderConfig;
import io.reviewmind.core.config.model.ProvidersConfig;
import io.reviewmind.core.config.model.ReviewMindConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class ConfigService {
    private static final Set<String> FREE_FORM_KEYS = Set.of("extraHeaders");

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ReviewMindConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ReviewMindConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ReviewMindConfig.defaults());
        JsonNode existingNode = camelCaseKeys(mapper.readTree(Files.readString(configPath)));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, ReviewMindConfig.class);
    }

    public void save(Path configPath, ReviewMindConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        ReviewMindConfig config;
        if (created || overwrite) {
            config = ReviewMindConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path memory = ConfigPaths.resolve(config.memory().path());
        Files.createDirectories(memory);
        return new InitResult(configPath, memory, created, overwritten);
    }

    /**
     * Fills provider API keys missing from the file with the matching environment variables.
     */
    public ReviewMindConfig withEnvironment(ReviewMindConfig config, Map<String, String> environment) {
        ProvidersConfig providers = config.providers();
        return config.withProviders(new ProvidersConfig(
            fromEnvironment(providers.anthropic(), environment.get("ANTHROPIC_API_KEY")),
            fromEnvironment(providers.openai(), environment.get("OPENAI_API_KEY")),
            fromEnvironment(providers.openrouter(), environment.get("OPENROUTER_API_KEY")),
            fromEnvironment(providers.cohere(), environment.get("COHERE_API_KEY"))
        ));
    }

    public String toPrettyJson(ReviewMindConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private ProviderConfig fromEnvironment(ProviderConfig provider, String key) {
        ProviderConfig base = provider == null ? ProviderConfig.defaults() : provider;
        if (base.configured() || key == null || key.isBlank()) {
            return base;
        }
        return base.withApiKey(key.trim());
    }

    /**
     * Rewrites snake_case keys so they merge onto the camelCase keys of the defaults tree.
     * Maps whose keys are user data, such as HTTP header names, are copied unchanged.
     */
    private JsonNode camelCaseKeys(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            ArrayNode converted = mapper.createArrayNode();
            node.forEach(item -> converted.add(camelCaseKeys(item)));
            return converted;
        }
        if (!node.isObject()) {
            return node;
        }
        ObjectNode converted = mapper.createObjectNode();
        node.fields().forEachRemaining(entry -> {
            String key = toCamelCase(entry.getKey());
            converted.set(key, FREE_FORM_KEYS.contains(key) ? entry.getValue() : camelCaseKeys(entry.getValue()));
        });
        return converted;
    }

    private static String toCamelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
