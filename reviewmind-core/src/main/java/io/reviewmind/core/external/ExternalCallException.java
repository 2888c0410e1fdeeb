package io.reviewmind.core.external;

import io.reviewmind.core.ReviewMindException;

/**
 * An embedding or generation call failed. Callers skip the affected unit and continue.
 */
public class ExternalCallException extends ReviewMindException {

    public ExternalCallException(String message) {
        super(message);
    }

    public ExternalCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
