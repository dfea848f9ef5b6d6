package com.clipper.platform.publisher.exception;

import lombok.Getter;

/**
 * Remote 4xx or a policy rejection. Surfaced verbatim, never retried automatically.
 */
@Getter
public class ApiException extends PublishException {

    private final Integer httpStatus;

    public ApiException(String message) {
        this(message, (Integer) null);
    }

    public ApiException(String message, Integer httpStatus) {
        super(PublishErrorType.API, message);
        this.httpStatus = httpStatus;
    }
}
