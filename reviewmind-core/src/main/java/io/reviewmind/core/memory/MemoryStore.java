package io.reviewmind.core.memory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Append-only store of review memories, searchable by embedding.
 */
public interface MemoryStore {
    long insert(MemoryEntry entry);

    List<SearchHit> search(float[] queryEmbedding, int topK);

    int size();

    /**
     * @throws IndexOutOfBoundsException when no entry has {@code id}
     */
    MemoryEntry get(long id);

    /**
     * Embedding dimension of the store, or {@code 0} while it is still undefined.
     */
    int dimension();

    List<MemoryEntry> entries();

    MemoryStats stats();

    void persist(Path directory) throws IOException;
}
