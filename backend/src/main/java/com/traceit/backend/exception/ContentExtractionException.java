package com.traceit.backend.exception;

/**
 * Failure of a single extractor. The router treats it as a signal to try the next one.
 */
public class ContentExtractionException extends RuntimeException {

    public ContentExtractionException(String message) {
        super(message);
    }

    public ContentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
