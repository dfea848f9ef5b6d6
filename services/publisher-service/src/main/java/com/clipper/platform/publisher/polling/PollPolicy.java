package com.clipper.platform.publisher.polling;

import lombok.Value;

import java.time.Duration;

@Value
public class PollPolicy {
    Duration interval;
    int maxAttempts;

    public Duration getTimeout() {
        return interval.multipliedBy(maxAttempts);
    }
}
