package io.reviewmind.core.provider;

public record GenerationOptions(int maxTokens, double temperature) {
    public GenerationOptions {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
        if (temperature < 0.0) {
            throw new IllegalArgumentException("temperature must be >= 0");
        }
    }
}
