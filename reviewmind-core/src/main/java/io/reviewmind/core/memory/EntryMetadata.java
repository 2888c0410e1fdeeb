package io.reviewmind.core.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public record EntryMetadata(
    String repository,
    long pullRequestId,
    String filePath,
    int lineNumber,
    String author,
    Set<String> tags,
    Instant timestamp
) {
    public EntryMetadata {
        repository = repository == null ? "" : repository.trim();
        filePath = filePath == null ? "" : filePath.trim();
        author = author == null ? "" : author.trim();
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(tags));
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
    }
}
