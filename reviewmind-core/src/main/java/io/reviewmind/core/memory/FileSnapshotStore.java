package io.reviewmind.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes a snapshot as two files in one directory: a raw vector index
 * ({@code index-NNNNNN.bin}) and {@code metadata.json}. A new index generation is written
 * first and {@code metadata.json} is then swapped in atomically, so readers only ever see a
 * complete pair.
 */
final class FileSnapshotStore {
    static final String VERSION = "reviewmind-memory/1";
    static final String METADATA_FILE = "metadata.json";

    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotStore.class);
    private static final int MAGIC = 0x52564D49;
    private static final int FORMAT_VERSION = 1;
    private static final int HEADER_BYTES = 16;
    private static final String INDEX_GLOB = "index-*.bin";
    private static final Pattern INDEX_NAME = Pattern.compile("index-(\\d+)\\.bin");

    private final Path directory;
    private final ObjectMapper mapper;

    FileSnapshotStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    void write(MemorySnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        long generation = latestGeneration() + 1;
        String indexFile = "index-%06d.bin".formatted(generation);

        byte[] indexBytes = encodeIndex(snapshot);
        CRC32 crc = new CRC32();
        crc.update(indexBytes);

        List<SnapshotDocument.StoredEntry> stored = new ArrayList<>(snapshot.entries().size());
        for (MemoryEntry entry : snapshot.entries()) {
            stored.add(new SnapshotDocument.StoredEntry(
                entry.id(),
                entry.fingerprint(),
                entry.snippet(),
                entry.comment(),
                entry.metadata()
            ));
        }
        SnapshotDocument document = new SnapshotDocument(
            VERSION,
            generation,
            snapshot.dimension(),
            snapshot.entries().size(),
            indexFile,
            crc.getValue(),
            Instant.now(),
            stored
        );

        Path indexPath = directory.resolve(indexFile);
        Path indexTmp = indexPath.resolveSibling(indexFile + ".tmp");
        Files.write(indexTmp, indexBytes);
        Files.move(indexTmp, indexPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        Path metadataPath = directory.resolve(METADATA_FILE);
        Path metadataTmp = metadataPath.resolveSibling(METADATA_FILE + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Files.writeString(metadataTmp, json + System.lineSeparator());
        Files.move(metadataTmp, metadataPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        removeStaleIndexes(indexFile);
    }

    MemorySnapshot read() throws IOException {
        Path metadataPath = directory.resolve(METADATA_FILE);
        if (!Files.exists(metadataPath)) {
            if (latestGeneration() > 0) {
                throw new CorruptStoreException("Found vector index in " + directory + " without " + METADATA_FILE);
            }
            return new MemorySnapshot(0, List.of());
        }

        SnapshotDocument document;
        try {
            document = mapper.readValue(Files.readString(metadataPath), SnapshotDocument.class);
        } catch (IOException e) {
            throw new CorruptStoreException("Unreadable snapshot metadata " + metadataPath + ": " + e.getMessage(), e);
        }
        if (!VERSION.equals(document.version())) {
            throw new CorruptStoreException("Unsupported snapshot version: " + document.version());
        }
        if (document.indexFile() == null || !INDEX_NAME.matcher(document.indexFile()).matches()) {
            throw new CorruptStoreException("Snapshot metadata names no valid index file");
        }

        Path indexPath = directory.resolve(document.indexFile());
        if (!Files.exists(indexPath)) {
            throw new CorruptStoreException("Snapshot metadata references missing index " + indexPath);
        }
        byte[] indexBytes = Files.readAllBytes(indexPath);
        CRC32 crc = new CRC32();
        crc.update(indexBytes);
        if (crc.getValue() != document.indexChecksum()) {
            throw new CorruptStoreException("Checksum mismatch for " + indexPath);
        }

        List<float[]> vectors = decodeIndex(indexBytes, document);
        if (document.entries().size() != vectors.size()) {
            throw new CorruptStoreException(
                "Snapshot holds " + document.entries().size() + " entries but " + vectors.size() + " vectors"
            );
        }

        List<MemoryEntry> entries = new ArrayList<>(vectors.size());
        for (int position = 0; position < vectors.size(); position++) {
            SnapshotDocument.StoredEntry stored = document.entries().get(position);
            if (stored.id() != position) {
                throw new CorruptStoreException("Entry at position " + position + " has id " + stored.id());
            }
            if (stored.metadata() == null) {
                throw new CorruptStoreException("Entry " + position + " has no metadata");
            }
            entries.add(new MemoryEntry(
                stored.id(),
                stored.fingerprint(),
                vectors.get(position),
                stored.snippet(),
                stored.comment(),
                stored.metadata()
            ));
        }
        return new MemorySnapshot(document.dimension(), entries);
    }

    private byte[] encodeIndex(MemorySnapshot snapshot) throws IOException {
        int dimension = snapshot.dimension();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(
            HEADER_BYTES + snapshot.entries().size() * Math.max(dimension, 0) * Float.BYTES
        );
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT_VERSION);
            out.writeInt(dimension);
            out.writeInt(snapshot.entries().size());
            for (MemoryEntry entry : snapshot.entries()) {
                for (float value : entry.embeddingView()) {
                    out.writeFloat(value);
                }
            }
        }
        return bytes.toByteArray();
    }

    private List<float[]> decodeIndex(byte[] indexBytes, SnapshotDocument document) throws IOException {
        if (indexBytes.length < HEADER_BYTES) {
            throw new CorruptStoreException("Vector index is truncated");
        }
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(indexBytes))) {
            if (in.readInt() != MAGIC) {
                throw new CorruptStoreException("Vector index has an unknown format");
            }
            int formatVersion = in.readInt();
            if (formatVersion != FORMAT_VERSION) {
                throw new CorruptStoreException("Unsupported vector index format version " + formatVersion);
            }
            int dimension = in.readInt();
            int count = in.readInt();
            if (dimension != document.dimension()) {
                throw new CorruptStoreException(
                    "Vector index dimension " + dimension + " does not match metadata dimension " + document.dimension()
                );
            }
            if (count != document.count()) {
                throw new CorruptStoreException("Vector index holds " + count + " vectors but metadata declares " + document.count());
            }
            long expectedBytes = HEADER_BYTES + (long) count * dimension * Float.BYTES;
            if (count < 0 || dimension < 0 || (count > 0 && dimension == 0) || indexBytes.length != expectedBytes) {
                throw new CorruptStoreException(
                    "Vector index size " + indexBytes.length + " does not fit " + count + " vectors of dimension " + dimension
                );
            }
            List<float[]> vectors = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = in.readFloat();
                }
                vectors.add(vector);
            }
            return vectors;
        }
    }

    private long latestGeneration() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        long latest = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, INDEX_GLOB)) {
            for (Path file : files) {
                Matcher matcher = INDEX_NAME.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    latest = Math.max(latest, Long.parseLong(matcher.group(1)));
                }
            }
        }
        return latest;
    }

    private void removeStaleIndexes(String currentIndexFile) throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, INDEX_GLOB)) {
            for (Path file : files) {
                if (!file.getFileName().toString().equals(currentIndexFile)) {
                    Files.deleteIfExists(file);
                    LOG.debug("Removed stale vector index {}", file);
                }
            }
        }
    }
}
