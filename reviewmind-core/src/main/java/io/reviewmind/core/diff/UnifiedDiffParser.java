package io.reviewmind.core.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the added lines out of unified diff text. Only lines after the first hunk header
 * are considered; file headers before it are ignored.
 */
public final class UnifiedDiffParser {
    private static final Pattern HUNK_HEADER = Pattern.compile("^@@ -\\d+(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@.*");

    public List<DiffLine> addedLines(String patch) {
        if (patch == null || patch.isBlank()) {
            return List.of();
        }
        List<DiffLine> added = new ArrayList<>();
        int newLine = -1;
        for (String line : patch.split("\r?\n", -1)) {
            OptionalInt hunkStart = hunkStart(line);
            if (hunkStart.isPresent()) {
                newLine = hunkStart.getAsInt();
                continue;
            }
            if (newLine < 0) {
                continue;
            }
            if (line.startsWith("+")) {
                added.add(new DiffLine(Math.max(newLine, 1), line.substring(1)));
                newLine++;
            } else if (line.startsWith(" ")) {
                newLine++;
            }
        }
        return List.copyOf(added);
    }

    static OptionalInt hunkStart(String line) {
        Matcher matcher = HUNK_HEADER.matcher(line);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(matcher.group(1)));
    }
}
