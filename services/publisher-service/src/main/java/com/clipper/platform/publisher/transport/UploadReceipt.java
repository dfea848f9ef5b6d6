package com.clipper.platform.publisher.transport;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class UploadReceipt {
    List<ChunkResponse> responses;

    public boolean isComplete() {
        return !responses.isEmpty() && last().getOutcome() == ChunkResponse.Outcome.COMPLETE;
    }

    public String getFinalBody() {
        return responses.isEmpty() ? null : last().getBody();
    }

    public List<String> getEtags() {
        return responses.stream().map(ChunkResponse::getEtag).collect(Collectors.toList());
    }

    private ChunkResponse last() {
        return responses.get(responses.size() - 1);
    }
}
