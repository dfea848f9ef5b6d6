package com.clipper.platform.publisher.transport;

import com.clipper.platform.publisher.exception.ValidationException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a payload of {@code totalBytes} into consecutive ranges of at most {@code chunkSize}
 * bytes. The ranges cover {@code [0, totalBytes)} exactly, in order.
 */
@Getter
public final class ChunkPlan {

    private final long totalBytes;
    private final long chunkSize;
    private final List<ByteRange> ranges;

    private ChunkPlan(long totalBytes, long chunkSize, List<ByteRange> ranges) {
        this.totalBytes = totalBytes;
        this.chunkSize = chunkSize;
        this.ranges = ranges;
    }

    public static ChunkPlan of(long totalBytes, long chunkSize) {
        if (totalBytes <= 0) {
            throw new ValidationException("Cannot upload an empty payload");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        long count = (totalBytes + chunkSize - 1) / chunkSize;
        List<ByteRange> ranges = new ArrayList<>((int) count);
        for (long start = 0; start < totalBytes; start += chunkSize) {
            ranges.add(new ByteRange(start, Math.min(start + chunkSize, totalBytes) - 1));
        }
        return new ChunkPlan(totalBytes, chunkSize, Collections.unmodifiableList(ranges));
    }

    /**
     * One chunk when the payload fits under {@code singleChunkLimit}, fixed-size chunks otherwise.
     */
    public static ChunkPlan withThreshold(long totalBytes, long singleChunkLimit, long chunkSize) {
        return totalBytes <= singleChunkLimit ? of(totalBytes, totalBytes) : of(totalBytes, chunkSize);
    }

    public int getChunkCount() {
        return ranges.size();
    }
}
