package io.reviewmind.core.memory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record MemoryStats(int entryCount, int dimension, Map<String, Integer> tagHistogram) {
    public MemoryStats {
        tagHistogram = tagHistogram == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(tagHistogram));
    }
}
