package io.reviewmind.core.ingest;

import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.diff.DiffChunk;
import io.reviewmind.core.diff.DiffChunker;
import io.reviewmind.core.embedding.EmbeddingClient;
import io.reviewmind.core.external.TimeBoxedCalls;
import io.reviewmind.core.external.TimeBoxedCalls.Outcome;
import io.reviewmind.core.memory.DimensionMismatchException;
import io.reviewmind.core.memory.EntryMetadata;
import io.reviewmind.core.memory.MemoryEntry;
import io.reviewmind.core.memory.MemoryStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grows the memory from finished reviews. Each inline comment is attached to the diff
 * chunk it was left on; the chunk text is embedded and stored with the comment. Entries
 * are appended on the calling thread in comment order.
 */
public final class IngestionPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(IngestionPipeline.class);

    private final MemoryStore store;
    private final EmbeddingClient embeddings;
    private final DiffChunker chunker;
    private final CommentTagger tagger;
    private final TimeBoxedCalls calls;

    public IngestionPipeline(
        MemoryStore store,
        EmbeddingClient embeddings,
        DiffChunker chunker,
        CommentTagger tagger,
        TimeBoxedCalls calls
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.chunker = Objects.requireNonNull(chunker, "chunker must not be null");
        this.tagger = Objects.requireNonNull(tagger, "tagger must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
    }

    public IngestionResult ingest(ReviewEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        List<DiffChunk> chunks = chunker.split(event.diffs(), event.prTitle());
        List<SkippedUnit> skipped = new ArrayList<>();

        List<Attachment> attachments = new ArrayList<>();
        List<DiffChunk> toEmbed = new ArrayList<>();
        Map<DiffChunk, Integer> embedSlot = new IdentityHashMap<>();
        for (ReviewComment comment : event.comments()) {
            if (comment.body().isBlank()) {
                skipped.add(new SkippedUnit(comment.filePath(), comment.line(), comment.line(), "blank comment"));
                continue;
            }
            DiffChunk chunk = locate(chunks, comment);
            if (chunk == null) {
                skipped.add(new SkippedUnit(comment.filePath(), comment.line(), comment.line(), "no added lines in file"));
                continue;
            }
            Integer slot = embedSlot.get(chunk);
            if (slot == null) {
                slot = toEmbed.size();
                embedSlot.put(chunk, slot);
                toEmbed.add(chunk);
            }
            attachments.add(new Attachment(comment, chunk, slot));
        }

        List<Outcome<float[]>> vectors = calls.map(toEmbed, chunk -> embeddings.embed(chunk.text()));

        List<MemoryEntry> appended = new ArrayList<>();
        for (Attachment attachment : attachments) {
            DiffChunk chunk = attachment.chunk();
            Outcome<float[]> vector = vectors.get(attachment.slot());
            if (!vector.succeeded()) {
                LOG.warn("Skipping comment on {}: embedding failed: {}", chunk.location(), vector.failure().getMessage());
                skipped.add(skip(chunk, "embedding failed: " + vector.failure().getMessage()));
                continue;
            }

            MemoryEntry draft = toEntry(event, attachment.comment(), chunk, vector.value());
            boolean wasEmpty = store.size() == 0;
            try {
                long id = store.insert(draft);
                appended.add(store.get(id));
            } catch (DimensionMismatchException e) {
                if (wasEmpty) {
                    throw e;
                }
                LOG.warn("Skipping comment on {}: {}", chunk.location(), e.getMessage());
                skipped.add(skip(chunk, e.getMessage()));
            }
        }

        LOG.info(
            "Ingested review of {}#{}: {} memories added, {} skipped, memory size {}",
            event.repository(),
            event.pullRequestId(),
            appended.size(),
            skipped.size(),
            store.size()
        );
        return new IngestionResult(appended, skipped);
    }

    /**
     * The chunk of the comment's file containing the comment line, else the closest one.
     */
    static DiffChunk locate(List<DiffChunk> chunks, ReviewComment comment) {
        DiffChunk best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (DiffChunk chunk : chunks) {
            if (!chunk.filePath().equals(comment.filePath())) {
                continue;
            }
            int distance = chunk.distanceTo(comment.line());
            if (distance < bestDistance) {
                best = chunk;
                bestDistance = distance;
            }
        }
        return best;
    }

    private MemoryEntry toEntry(ReviewEvent event, ReviewComment comment, DiffChunk chunk, float[] embedding) {
        EntryMetadata metadata = new EntryMetadata(
            event.repository(),
            event.pullRequestId(),
            comment.filePath(),
            comment.line(),
            comment.author(),
            tagger.tag(comment.body()),
            comment.timestamp() == null ? Instant.now() : comment.timestamp()
        );
        return MemoryEntry.draft(embedding, chunk.text(), comment.body().trim(), metadata);
    }

    private SkippedUnit skip(DiffChunk chunk, String reason) {
        return new SkippedUnit(chunk.filePath(), chunk.startLine(), chunk.endLine(), reason);
    }

    private record Attachment(ReviewComment comment, DiffChunk chunk, int slot) {
    }
}
