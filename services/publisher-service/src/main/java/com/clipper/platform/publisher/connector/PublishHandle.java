package com.clipper.platform.publisher.connector;

import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.polling.JobPhase;
import com.clipper.platform.publisher.transport.UploadTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Transient state of one publish job, passed from phase to phase. Lives only for the duration of
 * a single publish call.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PublishHandle {
    private Platform platform;

    @Builder.Default
    private JobPhase phase = JobPhase.INITIATED;

    // Container id, publish_id, video URN or upload session, depending on the platform
    private String jobId;

    private String uploadUrl;
    private String uploadToken;

    @Builder.Default
    private List<UploadTarget> uploadTargets = new ArrayList<>();

    // Whether the remote side processes the media asynchronously after transfer
    private boolean awaitProcessing;

    // Resource created by the platform once the upload completed (YouTube video id)
    private String resourceId;

    private String creatorUsername;
    private boolean shortForm;

    public PublishHandle advance(JobPhase next) {
        return toBuilder().phase(next).build();
    }
}
