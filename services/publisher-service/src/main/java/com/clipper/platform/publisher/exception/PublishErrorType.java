package com.clipper.platform.publisher.exception;

import lombok.Getter;

@Getter
public enum PublishErrorType {
    VALIDATION("VALIDATION_ERROR", false),
    AUTH("AUTH_ERROR", false),
    API("API_ERROR", false),
    GATEWAY("GATEWAY_ERROR", true),
    PROCESSING_FAILURE("PROCESSING_FAILED", false),
    TIMEOUT("TIMEOUT", true);

    private final String code;
    private final boolean retryable;

    PublishErrorType(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }
}
