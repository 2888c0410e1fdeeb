package io.reviewmind.core.memory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A past review comment together with the code it was left on. Entries are immutable;
 * the store assigns {@code id} on insert and it always equals the entry's position.
 */
public record MemoryEntry(
    long id,
    String fingerprint,
    float[] embedding,
    String snippet,
    String comment,
    EntryMetadata metadata
) {
    public static final long UNASSIGNED = -1;

    public MemoryEntry {
        Objects.requireNonNull(embedding, "embedding must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        embedding = embedding.clone();
        snippet = snippet == null ? "" : snippet;
        comment = comment == null ? "" : comment;
        fingerprint = fingerprint == null || fingerprint.isBlank()
            ? fingerprint(snippet, comment, metadata.pullRequestId())
            : fingerprint;
    }

    public static MemoryEntry draft(float[] embedding, String snippet, String comment, EntryMetadata metadata) {
        return new MemoryEntry(UNASSIGNED, null, embedding, snippet, comment, metadata);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    MemoryEntry withId(long newId) {
        return new MemoryEntry(newId, fingerprint, embedding, snippet, comment, metadata);
    }

    float[] embeddingView() {
        return embedding;
    }

    static String fingerprint(String snippet, String comment, long pullRequestId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((snippet + comment + pullRequestId).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MemoryEntry that)) {
            return false;
        }
        return id == that.id
            && fingerprint.equals(that.fingerprint)
            && Arrays.equals(embedding, that.embedding)
            && snippet.equals(that.snippet)
            && comment.equals(that.comment)
            && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, fingerprint, snippet, comment, metadata);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "MemoryEntry[id=" + id
            + ", fingerprint=" + fingerprint
            + ", dimension=" + embedding.length
            + ", author=" + metadata.author()
            + ", file=" + metadata.filePath() + ":" + metadata.lineNumber()
            + "]";
    }
}
