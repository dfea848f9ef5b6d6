package com.clipper.platform.publisher.transport;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChunkResponse {

    public enum Outcome {
        CONTINUE,
        COMPLETE
    }

    int index;
    int statusCode;
    Outcome outcome;
    String etag;
    String body;
}
