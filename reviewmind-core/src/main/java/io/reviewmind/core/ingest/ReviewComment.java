package io.reviewmind.core.ingest;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * An inline comment a human reviewer left on a pull request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewComment(
    @JsonAlias({"user", "reviewer"}) String author,
    @JsonAlias({"comment", "text"}) String body,
    @JsonAlias({"file_path", "path", "file"}) String filePath,
    int line,
    @JsonAlias({"created_at"}) Instant timestamp
) {
    public ReviewComment {
        author = author == null ? "" : author.trim();
        body = body == null ? "" : body;
        filePath = filePath == null ? "" : filePath.trim();
    }
}
