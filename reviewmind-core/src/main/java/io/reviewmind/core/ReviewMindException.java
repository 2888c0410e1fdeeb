package io.reviewmind.core;

/**
 * Base type for the failures the review memory can raise.
 */
public class ReviewMindException extends RuntimeException {

    public ReviewMindException(String message) {
        super(message);
    }

    public ReviewMindException(String message, Throwable cause) {
        super(message, cause);
    }
}
