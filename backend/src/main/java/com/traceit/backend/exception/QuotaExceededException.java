package com.traceit.backend.exception;

import lombok.Getter;

@Getter
public class QuotaExceededException extends LineagePipelineException {

    private final String userId;

    public QuotaExceededException(String userId) {
        super(ErrorKind.QUOTA_EXCEEDED, "Daily search quota exceeded");
        this.userId = userId;
    }
}
