package io.reviewmind.core.ingest;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.reviewmind.core.diff.FileDiff;
import java.util.List;

/**
 * A finished review: the diff that was reviewed and the inline comments left on it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewEvent(
    String repository,
    @JsonAlias({"pull_request_id", "pr_number"}) long pullRequestId,
    @JsonAlias({"pr_title", "title"}) String prTitle,
    @JsonAlias({"files"}) List<FileDiff> diffs,
    List<ReviewComment> comments
) {
    public ReviewEvent {
        repository = repository == null ? "" : repository.trim();
        prTitle = prTitle == null ? "" : prTitle;
        diffs = diffs == null ? List.of() : List.copyOf(diffs);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
