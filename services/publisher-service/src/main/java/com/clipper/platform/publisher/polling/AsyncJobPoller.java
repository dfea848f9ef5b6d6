package com.clipper.platform.publisher.polling;

import com.clipper.platform.publisher.exception.ProcessingFailureException;
import com.clipper.platform.publisher.exception.PublishTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Waits for a remote asynchronous job by probing it at a fixed interval.
 * <p>
 * The returned {@link Mono} emits the job result on {@code READY}, fails with
 * {@link ProcessingFailureException} as soon as a probe reports {@code ERROR}, and fails with
 * {@link PublishTimeoutException} after exactly {@code maxAttempts} probes without a terminal
 * state. The wait between probes is a non-blocking delay; disposing the subscription stops the
 * loop before the next probe is issued.
 */
@Component
@Slf4j
public class AsyncJobPoller {

    public <T> Mono<T> awaitReady(String jobName, PollPolicy policy, Supplier<Mono<JobStatus<T>>> probe) {
        return attempt(jobName, policy, probe, 1);
    }

    private <T> Mono<T> attempt(String jobName, PollPolicy policy, Supplier<Mono<JobStatus<T>>> probe, int attempt) {
        return Mono.defer(probe)
                .flatMap(status -> next(jobName, policy, probe, attempt, status));
    }

    private <T> Mono<T> next(String jobName, PollPolicy policy, Supplier<Mono<JobStatus<T>>> probe,
                             int attempt, JobStatus<T> status) {
        return switch (status.getPhase()) {
            case READY -> {
                log.info("{} ready after {} poll(s)", jobName, attempt);
                yield Mono.just(status.getResult());
            }
            case ERROR -> Mono.error(new ProcessingFailureException(jobName + " failed: "
                    + (status.getDetail() != null ? status.getDetail() : "remote processing error")));
            default -> {
                if (attempt >= policy.getMaxAttempts()) {
                    yield Mono.error(new PublishTimeoutException(jobName + " did not finish after "
                            + attempt + " polls (" + policy.getTimeout().toSeconds() + "s), last status: "
                            + status.getDetail()));
                }
                log.debug("{} still {} ({}), poll {}/{}", jobName, status.getPhase(), status.getDetail(),
                        attempt, policy.getMaxAttempts());
                yield Mono.delay(policy.getInterval())
                        .then(attempt(jobName, policy, probe, attempt + 1));
            }
        };
    }
}
