package com.clipper.platform.publisher.exception;

public class ProcessingFailureException extends PublishException {

    public ProcessingFailureException(String message) {
        super(PublishErrorType.PROCESSING_FAILURE, message);
    }

    public ProcessingFailureException(String message, Throwable cause) {
        super(PublishErrorType.PROCESSING_FAILURE, message, cause);
    }
}
