package io.reviewmind.core.external;

public final class ExternalCallTimeoutException extends ExternalCallException {

    public ExternalCallTimeoutException(String message) {
        super(message);
    }

    public ExternalCallTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
