package com.clipper.platform.publisher.exception;

/**
 * Remote 5xx, throttling or a transport failure. Safe to retry with backoff.
 */
public class GatewayException extends PublishException {

    public GatewayException(String message) {
        super(PublishErrorType.GATEWAY, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(PublishErrorType.GATEWAY, message, cause);
    }
}
