package com.clipper.platform.publisher.transport;

import com.clipper.platform.publisher.exception.GatewayException;
import lombok.Value;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient failures. Only {@link GatewayException}s are retried;
 * once the bound is hit the last failure is rethrown as is.
 */
@Value
public class RetryPolicy {
    int maxRetries;
    Duration initialBackoff;
    Duration maxBackoff;

    public Retry toRetrySpec() {
        return Retry.backoff(maxRetries, initialBackoff)
                .maxBackoff(maxBackoff)
                .filter(GatewayException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
