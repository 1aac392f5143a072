package com.traceit.backend.exception;

import lombok.Getter;

/**
 * Terminal failure of a pipeline run, reported to the caller by kind
 */
@Getter
public abstract class LineagePipelineException extends RuntimeException {

    private final ErrorKind kind;

    protected LineagePipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LineagePipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
