package com.traceit.backend.exception;

public class ContentTooSmallException extends ContentExtractionException {

    public ContentTooSmallException(String message) {
        super(message);
    }
}
