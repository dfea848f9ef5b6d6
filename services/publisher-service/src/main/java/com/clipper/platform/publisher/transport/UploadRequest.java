package com.clipper.platform.publisher.transport;

import com.clipper.platform.publisher.model.Platform;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class UploadRequest {
    Platform platform;
    MediaSource source;
    List<UploadTarget> targets;
    String contentType;

    // Send Content-Range on every chunk (resumable and chunked protocols)
    boolean contentRange;

    // Fail unless the last chunk is acknowledged as complete
    boolean requireCompletion;

    @Singular
    Map<String, String> headers;

    RetryPolicy retryPolicy;

    @Builder.Default
    UploadProgressListener progressListener = UploadProgressListener.NONE;
}
