package com.traceit.backend.exception;

public class PipelineCancelledException extends LineagePipelineException {

    public PipelineCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
