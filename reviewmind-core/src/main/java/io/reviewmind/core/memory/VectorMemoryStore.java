package io.reviewmind.core.memory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store backed by a {@link FlatVectorIndex}. The entry list and the index grow
 * together, so position {@code i} in one is always entry {@code i} in the other.
 */
public final class VectorMemoryStore implements MemoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(VectorMemoryStore.class);

    private final List<MemoryEntry> entries = new ArrayList<>();
    private int dimension;
    private FlatVectorIndex index;

    public VectorMemoryStore() {
        this(0);
    }

    /**
     * @param dimension fixed embedding dimension, or {@code 0} to adopt the first inserted entry's
     */
    public VectorMemoryStore(int dimension) {
        if (dimension < 0) {
            throw new IllegalArgumentException("dimension must be >= 0");
        }
        this.dimension = dimension;
        this.index = dimension > 0 ? new FlatVectorIndex(dimension) : null;
    }

    public static VectorMemoryStore load(Path directory, int expectedDimension) throws IOException {
        MemorySnapshot snapshot = new FileSnapshotStore(directory).read();
        if (snapshot.dimension() > 0 && expectedDimension > 0 && snapshot.dimension() != expectedDimension) {
            throw new DimensionMismatchException(expectedDimension, snapshot.dimension());
        }
        int dimension = snapshot.dimension() > 0 ? snapshot.dimension() : Math.max(0, expectedDimension);
        VectorMemoryStore store = new VectorMemoryStore(dimension);
        for (MemoryEntry entry : snapshot.entries()) {
            store.append(entry);
        }
        LOG.info("Loaded {} memories (dimension {}) from {}", store.size(), dimension, directory);
        return store;
    }

    @Override
    public synchronized long insert(MemoryEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        if (dimension == 0) {
            dimension = entry.dimension();
            index = new FlatVectorIndex(dimension);
            LOG.debug("Store dimension fixed to {} by first insert", dimension);
        } else if (entry.dimension() != dimension) {
            throw new DimensionMismatchException(dimension, entry.dimension());
        }
        return append(entry.withId(entries.size()));
    }

    @Override
    public synchronized List<SearchHit> search(float[] queryEmbedding, int topK) {
        if (entries.isEmpty() || topK <= 0) {
            return List.of();
        }
        if (queryEmbedding == null) {
            throw new IllegalArgumentException("queryEmbedding must not be null");
        }
        List<SearchHit> hits = new ArrayList<>();
        for (FlatVectorIndex.Neighbor neighbor : index.nearest(queryEmbedding, topK)) {
            hits.add(new SearchHit(entries.get(neighbor.position()), neighbor.distance()));
        }
        return hits;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized MemoryEntry get(long id) {
        if (id < 0 || id >= entries.size()) {
            throw new IndexOutOfBoundsException("No memory with id " + id + " (size " + entries.size() + ")");
        }
        return entries.get((int) id);
    }

    @Override
    public synchronized int dimension() {
        return dimension;
    }

    @Override
    public synchronized List<MemoryEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized MemoryStats stats() {
        Map<String, Integer> histogram = new TreeMap<>();
        for (MemoryEntry entry : entries) {
            for (String tag : entry.metadata().tags()) {
                histogram.merge(tag, 1, Integer::sum);
            }
        }
        return new MemoryStats(entries.size(), dimension, histogram);
    }

    @Override
    public synchronized void persist(Path directory) throws IOException {
        new FileSnapshotStore(directory).write(new MemorySnapshot(dimension, entries));
        LOG.info("Persisted {} memories to {}", entries.size(), directory);
    }

    private long append(MemoryEntry entry) {
        if (entry.id() != entries.size()) {
            throw new CorruptStoreException("Entry id " + entry.id() + " does not match position " + entries.size());
        }
        if (index == null) {
            dimension = entry.dimension();
            index = new FlatVectorIndex(dimension);
        }
        index.add(entry.embeddingView());
        entries.add(entry);
        return entry.id();
    }
}
