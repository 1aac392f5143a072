package com.traceit.backend.exception;

public class UnsupportedInputException extends LineagePipelineException {

    public UnsupportedInputException(String message) {
        super(ErrorKind.UNSUPPORTED_INPUT, message);
    }
}
