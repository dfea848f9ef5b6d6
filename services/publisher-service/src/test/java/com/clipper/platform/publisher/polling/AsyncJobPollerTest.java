package com.clipper.platform.publisher.polling;

import com.clipper.platform.publisher.exception.ProcessingFailureException;
import com.clipper.platform.publisher.exception.PublishTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncJobPollerTest {

    private static final PollPolicy POLICY = new PollPolicy(Duration.ofSeconds(2), 30);

    private final AsyncJobPoller poller = new AsyncJobPoller();
    private final AtomicInteger probes = new AtomicInteger();

    @AfterEach
    void resetVirtualTime() {
        VirtualTimeScheduler.reset();
    }

    @Test
    void timesOutAfterExactlyMaxAttemptsProbes() {
        StepVerifier.withVirtualTime(() -> poller.<String>awaitReady("job", POLICY, () -> {
                    probes.incrementAndGet();
                    return Mono.just(JobStatus.processing("IN_PROGRESS"));
                }))
                .thenAwait(Duration.ofMinutes(5))
                .expectError(PublishTimeoutException.class)
                .verify();

        assertThat(probes).hasValue(30);
    }

    @Test
    void returnsTheResultOnceReady() {
        StepVerifier.withVirtualTime(() -> poller.awaitReady("job", POLICY, () -> Mono.just(
                        probes.incrementAndGet() < 4 ? JobStatus.<String>processing("IN_PROGRESS") : JobStatus.ready("done"))))
                .thenAwait(Duration.ofSeconds(6))
                .expectNext("done")
                .verifyComplete();

        assertThat(probes).hasValue(4);
    }

    @Test
    void errorStopsPollingImmediately() {
        StepVerifier.withVirtualTime(() -> poller.awaitReady("job", POLICY, () -> Mono.just(
                        probes.incrementAndGet() < 2 ? JobStatus.<String>processing("IN_PROGRESS") : JobStatus.<String>error("bad codec"))))
                .thenAwait(Duration.ofMinutes(5))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ProcessingFailureException.class)
                        .hasMessageContaining("bad codec"))
                .verify();

        assertThat(probes).hasValue(2);
    }

    @Test
    void timeoutIsNotAProcessingFailure() {
        PublishTimeoutException timeout = new PublishTimeoutException("slow");

        assertThat(timeout).isNotInstanceOf(ProcessingFailureException.class);
        assertThat(timeout.isRetryable()).isTrue();
        assertThat(new ProcessingFailureException("broken").isRetryable()).isFalse();
    }

    @Test
    void cancellingStopsFurtherProbes() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.getOrSet();
        Disposable subscription = poller.<String>awaitReady("job", POLICY, () -> {
            probes.incrementAndGet();
            return Mono.just(JobStatus.processing("IN_PROGRESS"));
        }).subscribe();

        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertThat(probes).hasValue(3);

        subscription.dispose();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(probes).hasValue(3);
    }
}
