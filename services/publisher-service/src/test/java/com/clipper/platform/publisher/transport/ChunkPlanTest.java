package com.clipper.platform.publisher.transport;

import com.clipper.platform.publisher.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlanTest {

    private static final long MB = 1024 * 1024;

    @Test
    void chunkCountIsTheCeilingOfSizeOverChunk() {
        assertThat(ChunkPlan.of(200 * MB, 10 * MB).getChunkCount()).isEqualTo(20);
        assertThat(ChunkPlan.of(200 * MB + 1, 10 * MB).getChunkCount()).isEqualTo(21);
        assertThat(ChunkPlan.of(1, 10 * MB).getChunkCount()).isEqualTo(1);
    }

    @Test
    void rangesCoverThePayloadExactlyOnceInOrder() {
        ChunkPlan plan = ChunkPlan.of(25, 10);
        List<ByteRange> ranges = plan.getRanges();

        assertThat(ranges).containsExactly(new ByteRange(0, 9), new ByteRange(10, 19), new ByteRange(20, 24));
        assertThat(ranges.stream().mapToLong(ByteRange::length).sum()).isEqualTo(25);
        assertThat(ranges.get(2).contentRange(25)).isEqualTo("bytes 20-24/25");
    }

    @Test
    void smallPayloadGoesAsOneChunkUnderTheThreshold() {
        ChunkPlan plan = ChunkPlan.withThreshold(30 * MB, 64 * MB, 10 * MB);

        assertThat(plan.getChunkCount()).isEqualTo(1);
        assertThat(plan.getChunkSize()).isEqualTo(30 * MB);
    }

    @Test
    void largePayloadIsSplitAboveTheThreshold() {
        ChunkPlan plan = ChunkPlan.withThreshold(200 * MB, 64 * MB, 10 * MB);

        assertThat(plan.getChunkCount()).isEqualTo(20);
        assertThat(plan.getChunkSize()).isEqualTo(10 * MB);
    }

    @Test
    void emptyPayloadIsRejected() {
        assertThatThrownBy(() -> ChunkPlan.of(0, 10)).isInstanceOf(ValidationException.class);
    }
}
