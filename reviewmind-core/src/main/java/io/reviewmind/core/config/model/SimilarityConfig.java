package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Acceptance threshold curve. A memory of {@code n} entries uses the threshold of the first
 * step whose {@code upTo} is at least {@code n}; larger memories use {@code maxThreshold}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimilarityConfig(
    @JsonAlias({"min_threshold"}) double minThreshold,
    @JsonAlias({"max_threshold"}) double maxThreshold,
    List<ThresholdStep> steps
) {
    public SimilarityConfig {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static SimilarityConfig defaults() {
        return new SimilarityConfig(
            0.2,
            0.4,
            List.of(new ThresholdStep(5, 0.2), new ThresholdStep(10, 0.3))
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThresholdStep(
        @JsonAlias({"up_to"}) int upTo,
        double threshold
    ) {
    }
}
