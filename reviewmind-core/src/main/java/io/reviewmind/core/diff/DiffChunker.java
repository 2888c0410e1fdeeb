package io.reviewmind.core.diff;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits file diffs into chunks of at most {@code maxLines} consecutive added lines.
 * Output order is files in diff order, then ascending line numbers.
 */
public final class DiffChunker {
    public static final int DEFAULT_MAX_LINES = 20;

    private final int maxLines;

    public DiffChunker() {
        this(DEFAULT_MAX_LINES);
    }

    public DiffChunker(int maxLines) {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be > 0");
        }
        this.maxLines = maxLines;
    }

    public int maxLines() {
        return maxLines;
    }

    public List<DiffChunk> split(List<FileDiff> fileDiffs, String prTitle) {
        if (fileDiffs == null || fileDiffs.isEmpty()) {
            return List.of();
        }
        List<DiffChunk> chunks = new ArrayList<>();
        for (FileDiff fileDiff : fileDiffs) {
            chunks.addAll(splitFile(fileDiff.resolved(), prTitle));
        }
        return List.copyOf(chunks);
    }

    private List<DiffChunk> splitFile(FileDiff fileDiff, String prTitle) {
        List<DiffLine> lines = sortedUnique(fileDiff);
        if (lines.isEmpty()) {
            return List.of();
        }

        List<DiffChunk> chunks = new ArrayList<>();
        List<DiffLine> run = new ArrayList<>();
        for (DiffLine line : lines) {
            boolean continuesRun = !run.isEmpty() && line.lineNumber() == run.get(run.size() - 1).lineNumber() + 1;
            if (!run.isEmpty() && (!continuesRun || run.size() == maxLines)) {
                chunks.add(toChunk(fileDiff.path(), run, lines.size(), prTitle));
                run = new ArrayList<>();
            }
            run.add(line);
        }
        chunks.add(toChunk(fileDiff.path(), run, lines.size(), prTitle));
        return chunks;
    }

    private List<DiffLine> sortedUnique(FileDiff fileDiff) {
        List<DiffLine> lines = new ArrayList<>(fileDiff.addedLines());
        lines.sort(Comparator.comparingInt(DiffLine::lineNumber));
        Set<Integer> seen = new HashSet<>();
        for (DiffLine line : lines) {
            if (!seen.add(line.lineNumber())) {
                throw new IllegalArgumentException(
                    "duplicate added line " + line.lineNumber() + " in " + fileDiff.path()
                );
            }
        }
        return lines;
    }

    private DiffChunk toChunk(String path, List<DiffLine> run, int addedLineCount, String prTitle) {
        int start = run.get(0).lineNumber();
        int end = run.get(run.size() - 1).lineNumber();
        List<String> texts = new ArrayList<>(run.size());
        for (DiffLine line : run) {
            texts.add(line.text());
        }
        String summary = path + ": lines " + start + "-" + end + " of " + addedLineCount + " added line(s)";
        return new DiffChunk(path, start, end, String.join("\n", texts), new ChunkContext(prTitle, summary));
    }
}
