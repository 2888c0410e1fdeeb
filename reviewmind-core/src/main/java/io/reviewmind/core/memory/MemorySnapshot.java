package io.reviewmind.core.memory;

import java.util.List;

record MemorySnapshot(int dimension, List<MemoryEntry> entries) {
    MemorySnapshot {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
