package com.clipper.platform.publisher.exception;

public class ValidationException extends PublishException {

    public ValidationException(String message) {
        super(PublishErrorType.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(PublishErrorType.VALIDATION, message, cause);
    }
}
