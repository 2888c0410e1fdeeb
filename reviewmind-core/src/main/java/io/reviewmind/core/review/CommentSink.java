package io.reviewmind.core.review;

import java.util.OptionalInt;

/**
 * Destination for generated review comments.
 */
public interface CommentSink {
    /**
     * @param position position of {@code line} in the file's unified diff, empty when the
     *                 change carried no patch text for the file
     */
    void postInline(String filePath, int line, OptionalInt position, String body);

    void postGeneral(String body);
}
