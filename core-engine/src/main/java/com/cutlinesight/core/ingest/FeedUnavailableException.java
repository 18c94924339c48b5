package com.cutlinesight.core.ingest;

/**
 * Raised when the event feed cannot be reached or its document is
 * structurally malformed.
 *
 * @since 1.0.0
 */
public class FeedUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
