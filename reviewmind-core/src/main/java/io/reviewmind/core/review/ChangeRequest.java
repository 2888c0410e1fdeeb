package io.reviewmind.core.review;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.reviewmind.core.diff.FileDiff;
import java.util.List;
import java.util.Optional;

/**
 * A newly opened change to generate suggestions for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeRequest(
    String repository,
    @JsonAlias({"pull_request_id", "pr_number"}) long pullRequestId,
    @JsonAlias({"pr_title", "title"}) String prTitle,
    @JsonAlias({"files"}) List<FileDiff> diffs
) {
    public ChangeRequest {
        repository = repository == null ? "" : repository.trim();
        prTitle = prTitle == null ? "" : prTitle;
        diffs = diffs == null ? List.of() : List.copyOf(diffs);
    }

    public Optional<FileDiff> diff(String path) {
        return diffs.stream().filter(diff -> diff.path().equals(path)).findFirst();
    }
}
