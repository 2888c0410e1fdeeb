package io.reviewmind.core.ingest;

import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.memory.MemoryEntry;
import java.util.List;

public record IngestionResult(List<MemoryEntry> appended, List<SkippedUnit> skipped) {
    public IngestionResult {
        appended = appended == null ? List.of() : List.copyOf(appended);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }
}
