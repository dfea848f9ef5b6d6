package com.clipper.platform.publisher.exception;

/**
 * Polling ran out of attempts before the remote job reached a terminal state.
 */
public class PublishTimeoutException extends PublishException {

    public PublishTimeoutException(String message) {
        super(PublishErrorType.TIMEOUT, message);
    }

    public PublishTimeoutException(String message, Throwable cause) {
        super(PublishErrorType.TIMEOUT, message, cause);
    }
}
