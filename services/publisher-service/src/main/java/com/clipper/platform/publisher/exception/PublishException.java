package com.clipper.platform.publisher.exception;

import lombok.Getter;

/**
 * Base of every failure a publish can end with. Adapters, the transport and the credential vault
 * only ever raise subclasses of this type; the orchestrator turns them into a failed post.
 */
@Getter
public abstract class PublishException extends RuntimeException {

    private final PublishErrorType type;

    protected PublishException(PublishErrorType type, String message) {
        super(message);
        this.type = type;
    }

    protected PublishException(PublishErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
