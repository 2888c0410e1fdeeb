package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationConfig(
    String provider,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    double temperature,
    @JsonAlias({"max_exemplars"}) int maxExemplars,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"rules_path"}) String rulesPath
) {

    public static GenerationConfig defaults() {
        return new GenerationConfig(
            "anthropic",
            "claude-3-5-sonnet-20241022",
            300,
            0.3,
            3,
            30,
            ""
        );
    }
}
