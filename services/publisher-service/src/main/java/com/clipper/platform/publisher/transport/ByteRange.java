package com.clipper.platform.publisher.transport;

import lombok.Value;

/**
 * Inclusive byte range {@code [start, end]} of a payload.
 */
@Value
public class ByteRange {
    long start;
    long end;

    public long length() {
        return end - start + 1;
    }

    public String contentRange(long totalBytes) {
        return "bytes " + start + "-" + end + "/" + totalBytes;
    }
}
