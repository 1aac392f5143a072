package com.traceit.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorKind {
    UNSUPPORTED_INPUT("unsupported_input", HttpStatus.UNPROCESSABLE_ENTITY),
    QUOTA_EXCEEDED("quota_exceeded", HttpStatus.TOO_MANY_REQUESTS),
    EXTRACTION_FAILED("extraction_failed", HttpStatus.UNPROCESSABLE_ENTITY),
    CANCELLED("cancelled", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final HttpStatus status;

    ErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }
}
