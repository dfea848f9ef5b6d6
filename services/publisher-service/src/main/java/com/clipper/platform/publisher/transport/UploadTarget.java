package com.clipper.platform.publisher.transport;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Where one byte range of the payload is sent.
 */
@Value
public class UploadTarget {
    String url;
    ByteRange range;

    public static List<UploadTarget> forPlan(String url, ChunkPlan plan) {
        return plan.getRanges().stream()
                .map(range -> new UploadTarget(url, range))
                .collect(Collectors.toList());
    }
}
