package io.reviewmind.core.memory;

import io.reviewmind.core.ReviewMindException;

/**
 * A persisted snapshot is inconsistent and must not be loaded.
 */
public final class CorruptStoreException extends ReviewMindException {

    public CorruptStoreException(String message) {
        super(message);
    }

    public CorruptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
