package com.clipper.platform.publisher.exception;

import com.clipper.platform.publisher.model.Platform;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw HTTP outcomes onto the publish error taxonomy.
 */
public final class RemoteErrors {

    private RemoteErrors() {
    }

    public static PublishException fromStatus(Platform platform, int status, String message) {
        String text = platform.getDisplayName() + " API error (" + status + "): " + message;
        if (status == 401) {
            return new AuthException(text);
        }
        if (status == 429 || status >= 500) {
            return new GatewayException(text);
        }
        return new ApiException(text, status);
    }

    public static Throwable fromTransport(Platform platform, Throwable error) {
        if (error instanceof PublishException) {
            return error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return fromStatus(platform, response.getStatusCode().value(), response.getResponseBodyAsString());
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return new GatewayException(platform.getDisplayName() + " unreachable: " + error.getMessage(), error);
        }
        return error;
    }

    /**
     * Applies the call timeout and translates transport failures for one remote call.
     */
    public static <T> Mono<T> guard(Platform platform, Duration timeout, Mono<T> call) {
        return call.timeout(timeout)
                .onErrorMap(error -> fromTransport(platform, error));
    }
}
