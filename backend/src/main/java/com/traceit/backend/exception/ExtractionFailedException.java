package com.traceit.backend.exception;

public class ExtractionFailedException extends LineagePipelineException {

    public ExtractionFailedException(String message) {
        super(ErrorKind.EXTRACTION_FAILED, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_FAILED, message, cause);
    }
}
