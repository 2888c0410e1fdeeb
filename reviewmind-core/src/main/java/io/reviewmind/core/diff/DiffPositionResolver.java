package io.reviewmind.core.diff;

import java.util.OptionalInt;

/**
 * Maps a new-file line number to its position in a unified diff, as used by inline review
 * comments: the line below the first hunk header is position 1, and later hunk headers
 * count as positions too.
 */
public final class DiffPositionResolver {

    public OptionalInt position(String patch, int targetLine) {
        if (patch == null || patch.isBlank() || targetLine < 1) {
            return OptionalInt.empty();
        }
        int position = 0;
        int newLine = -1;
        for (String line : patch.split("\r?\n", -1)) {
            OptionalInt hunkStart = UnifiedDiffParser.hunkStart(line);
            if (hunkStart.isPresent()) {
                if (newLine >= 0) {
                    position++;
                }
                newLine = hunkStart.getAsInt();
                continue;
            }
            if (newLine < 0) {
                continue;
            }
            position++;
            if (line.startsWith("+")) {
                if (newLine == targetLine) {
                    return OptionalInt.of(position);
                }
                newLine++;
            } else if (line.startsWith(" ")) {
                newLine++;
            }
        }
        return OptionalInt.empty();
    }
}
