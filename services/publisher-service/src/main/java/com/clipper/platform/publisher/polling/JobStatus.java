package com.clipper.platform.publisher.polling;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * One observation of a remote asynchronous job. A {@code READY} status carries the job's result.
 */
@Getter
@ToString
public final class JobStatus<T> {

    private final JobPhase phase;
    private final String detail;
    private final T result;

    private JobStatus(JobPhase phase, String detail, T result) {
        this.phase = phase;
        this.detail = detail;
        this.result = result;
    }

    public static <T> JobStatus<T> ready(T result) {
        return new JobStatus<>(JobPhase.READY, null, Objects.requireNonNull(result, "result"));
    }

    public static <T> JobStatus<T> processing(String detail) {
        return new JobStatus<>(JobPhase.PROCESSING, detail, null);
    }

    public static <T> JobStatus<T> uploading(String detail) {
        return new JobStatus<>(JobPhase.UPLOADING, detail, null);
    }

    public static <T> JobStatus<T> error(String detail) {
        return new JobStatus<>(JobPhase.ERROR, detail, null);
    }
}
