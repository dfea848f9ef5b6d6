package com.clipper.platform.publisher.exception;

/**
 * The platform rejected the credential as invalid or expired.
 */
public class AuthException extends PublishException {

    public AuthException(String message) {
        super(PublishErrorType.AUTH, message);
    }

    public AuthException(String message, Throwable cause) {
        super(PublishErrorType.AUTH, message, cause);
    }
}
