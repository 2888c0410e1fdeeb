package io.reviewmind.core.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reviewmind.core.SkippedUnit;
import io.reviewmind.core.suggestion.Provenance;
import io.reviewmind.core.suggestion.Suggestion;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a {@link ReviewReport} as the {@code generated_review.json} document consumed by
 * comment posting tools.
 */
public final class GeneratedReviewWriter {
    public static final String DEFAULT_FILE_NAME = "generated_review.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toDocument(ReviewReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("pr_number", report.pullRequestId());

        ArrayNode comments = root.putArray("comments");
        for (Suggestion suggestion : report.suggestions()) {
            ObjectNode comment = comments.addObject();
            comment.put("file", suggestion.chunk().filePath());
            comment.put("line", suggestion.chunk().startLine());
            comment.put("comment", suggestion.commentText());
            ArrayNode tags = comment.putArray("tags");
            suggestion.tags().forEach(tags::add);
            ArrayNode similarity = comment.putArray("similarity_info");
            for (Provenance provenance : suggestion.provenance()) {
                ObjectNode info = similarity.addObject();
                info.put("similarity", provenance.score());
                info.put("reviewer", provenance.author());
            }
        }
        if (report.hasSummary()) {
            root.put("summary", report.summary());
        }

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("total_chunks_analyzed", report.chunksAnalyzed());
        metadata.put("chunks_with_similar_reviews", report.chunksWithMatches());
        metadata.put("comments_generated", report.suggestions().size());
        metadata.put("memory_size", report.memorySize());
        metadata.put("threshold", report.threshold());
        ArrayNode skipped = metadata.putArray("skipped");
        for (SkippedUnit unit : report.skipped()) {
            ObjectNode row = skipped.addObject();
            row.put("file", unit.filePath());
            row.put("start_line", unit.startLine());
            row.put("end_line", unit.endLine());
            row.put("reason", unit.reason());
        }
        return root;
    }

    public void write(Path target, ReviewReport report) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(report)));
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
