package io.reviewmind.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;

/**
 * Metadata half of a persisted snapshot. It names the index file it belongs to and is
 * written last, so it is the commit point of a snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotDocument(
    String version,
    long generation,
    int dimension,
    int count,
    String indexFile,
    long indexChecksum,
    Instant savedAt,
    List<StoredEntry> entries
) {
    public SnapshotDocument {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StoredEntry(
        long id,
        String fingerprint,
        String snippet,
        String comment,
        EntryMetadata metadata
    ) {
    }
}
