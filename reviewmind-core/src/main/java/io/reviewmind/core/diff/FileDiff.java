package io.reviewmind.core.diff;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * The added lines of one changed file. {@code patch} keeps the unified diff text when the
 * diff was parsed from one, so inline positions can be resolved later.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileDiff(
    @JsonAlias({"filename", "file_path"}) String path,
    @JsonAlias({"added_lines"}) List<DiffLine> addedLines,
    String patch
) {
    public FileDiff {
        path = path == null ? "" : path.trim();
        addedLines = addedLines == null ? List.of() : List.copyOf(addedLines);
        patch = patch == null ? "" : patch;
    }

    public static FileDiff of(String path, List<DiffLine> addedLines) {
        return new FileDiff(path, addedLines, "");
    }

    public static FileDiff fromPatch(String path, String patch) {
        return new FileDiff(path, new UnifiedDiffParser().addedLines(patch), patch);
    }

    /**
     * Parses {@code patch} when the added lines were not given explicitly.
     */
    public FileDiff resolved() {
        if (!addedLines.isEmpty() || patch.isBlank()) {
            return this;
        }
        return fromPatch(path, patch);
    }
}
