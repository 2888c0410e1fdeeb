package io.reviewmind.core.similarity;

import io.reviewmind.core.config.model.SimilarityConfig;
import io.reviewmind.core.config.model.SimilarityConfig.ThresholdStep;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Size-adaptive acceptance policy. Sparse memories accept weaker matches; once enough
 * reviews exist the threshold rises towards {@code maxThreshold}. The threshold never
 * decreases as the memory grows and always stays within the configured bounds.
 */
public final class SimilarityPolicy {
    private static final Comparator<SimilarityMatch> RANK_ORDER = Comparator
        .comparingDouble(SimilarityMatch::score).reversed()
        .thenComparingLong(match -> match.entry().id());

    private final double minThreshold;
    private final double maxThreshold;
    private final List<ThresholdStep> steps;

    public SimilarityPolicy(SimilarityConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        double min = config.minThreshold();
        double max = config.maxThreshold();
        if (!(min >= 0.0 && max <= 1.0 && min <= max)) {
            throw new IllegalArgumentException("threshold bounds must satisfy 0 <= min <= max <= 1, got [" + min + ", " + max + "]");
        }
        this.minThreshold = min;
        this.maxThreshold = max;
        this.steps = normalize(config.steps(), min, max);
    }

    public double minThreshold() {
        return minThreshold;
    }

    public double maxThreshold() {
        return maxThreshold;
    }

    public double threshold(int memorySize) {
        int size = Math.max(0, memorySize);
        for (ThresholdStep step : steps) {
            if (size <= step.upTo()) {
                return step.threshold();
            }
        }
        return maxThreshold;
    }

    /**
     * Marks every match against {@code threshold} and orders them by descending score, then
     * ascending entry id. Rejected matches stay in the result.
     */
    public List<SimilarityMatch> rank(List<SimilarityMatch> matches, double threshold) {
        if (matches == null || matches.isEmpty()) {
            return List.of();
        }
        List<SimilarityMatch> ranked = new ArrayList<>(matches.size());
        for (SimilarityMatch match : matches) {
            ranked.add(match.withAccepted(match.score() >= threshold));
        }
        ranked.sort(RANK_ORDER);
        return List.copyOf(ranked);
    }

    private static List<ThresholdStep> normalize(List<ThresholdStep> configured, double min, double max) {
        List<ThresholdStep> sorted = new ArrayList<>(configured == null ? List.of() : configured);
        sorted.sort(Comparator.comparingInt(ThresholdStep::upTo));
        List<ThresholdStep> normalized = new ArrayList<>(sorted.size());
        double floor = min;
        for (ThresholdStep step : sorted) {
            if (Double.isNaN(step.threshold())) {
                throw new IllegalArgumentException("threshold step up to " + step.upTo() + " is not a number");
            }
            double value = Math.min(max, Math.max(floor, step.threshold()));
            normalized.add(new ThresholdStep(step.upTo(), value));
            floor = value;
        }
        return List.copyOf(normalized);
    }
}
