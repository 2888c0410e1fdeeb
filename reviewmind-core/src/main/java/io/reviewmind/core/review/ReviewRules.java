package io.reviewmind.core.review;

import io.reviewmind.core.config.ConfigPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Team review guidelines handed to the generator alongside the exemplars.
 */
public final class ReviewRules {
    private static final Logger LOG = LoggerFactory.getLogger(ReviewRules.class);

    private ReviewRules() {
    }

    /**
     * Reads the rules file, or returns an empty text when no path is configured or the file
     * does not exist.
     */
    public static String read(String rawPath) throws IOException {
        if (rawPath == null || rawPath.isBlank()) {
            return "";
        }
        Path path = ConfigPaths.resolve(rawPath.trim());
        if (!Files.isRegularFile(path)) {
            LOG.warn("Review rules file {} not found, continuing without rules", path);
            return "";
        }
        return Files.readString(path);
    }
}
