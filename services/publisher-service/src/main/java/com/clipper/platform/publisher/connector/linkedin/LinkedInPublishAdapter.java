package com.clipper.platform.publisher.connector.linkedin;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.PlatformPostRef;
import com.clipper.platform.publisher.connector.PublishAdapter;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.connector.PublishHandle;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.MediaItem;
import com.clipper.platform.publisher.entity.metadata.LinkedInMetadata;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.MediaKind;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.model.Visibility;
import com.clipper.platform.publisher.polling.AsyncJobPoller;
import com.clipper.platform.publisher.polling.JobPhase;
import com.clipper.platform.publisher.polling.JobStatus;
import com.clipper.platform.publisher.storage.MediaLocator;
import com.clipper.platform.publisher.transport.ByteRange;
import com.clipper.platform.publisher.transport.ChunkPlan;
import com.clipper.platform.publisher.transport.MediaSource;
import com.clipper.platform.publisher.transport.UploadRequest;
import com.clipper.platform.publisher.transport.UploadTarget;
import com.clipper.platform.publisher.transport.UploadTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * LinkedIn image and video posts. Media is registered first, uploaded to the URLs LinkedIn hands
 * out, and only then referenced from a post. Videos are uploaded in the parts LinkedIn dictates,
 * committed with the parts' ETags and processed asynchronously.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkedInPublishAdapter implements PublishAdapter {

    private static final String STATUS_AVAILABLE = "AVAILABLE";
    private static final String STATUS_FAILED = "PROCESSING_FAILED";

    private final LinkedInApiClient apiClient;
    private final UploadTransport uploadTransport;
    private final MediaLocator mediaLocator;
    private final AsyncJobPoller poller;
    private final PublishingProperties properties;

    @Override
    public Platform getPlatform() {
        return Platform.LINKEDIN;
    }

    @Override
    public void validate(MediaAsset media, ComposedContent content) {
        if (media.getKind() != MediaKind.IMAGE && media.getKind() != MediaKind.VIDEO) {
            throw new ValidationException("LinkedIn posts take a single image or video, got " + media.getKind());
        }
        if (media.getStorageKey() == null) {
            throw new ValidationException("LinkedIn uploads need the media in object storage");
        }
    }

    @Override
    public Mono<PublishHandle> initiate(PublishContext context) {
        validate(context.getMedia(), context.getContent());
        String owner = authorUrn(context);
        MediaItem item = context.getMedia().asItem();

        log.info("Registering LinkedIn {} upload for post {}", context.getMedia().getKind(), context.getPost().getId());

        if (context.getMedia().getKind() == MediaKind.IMAGE) {
            return source(item).flatMap(source -> apiClient.initializeImageUpload(context.accessToken(), owner)
                    .map(upload -> PublishHandle.builder()
                            .platform(Platform.LINKEDIN)
                            .phase(JobPhase.UPLOADING)
                            .jobId(upload.getImage())
                            .uploadUrl(upload.getUploadUrl())
                            .uploadTargets(UploadTarget.forPlan(upload.getUploadUrl(),
                                    ChunkPlan.of(source.size(), source.size())))
                            .awaitProcessing(false)
                            .build()));
        }

        return source(item).flatMap(source -> apiClient.initializeVideoUpload(context.accessToken(), owner, source.size()))
                .map(upload -> PublishHandle.builder()
                        .platform(Platform.LINKEDIN)
                        .phase(JobPhase.UPLOADING)
                        .jobId(upload.getVideo())
                        .uploadToken(upload.getUploadToken())
                        .uploadTargets(toTargets(upload.getUploadInstructions()))
                        .awaitProcessing(true)
                        .build());
    }

    static List<UploadTarget> toTargets(List<UploadInstruction> instructions) {
        return instructions.stream()
                .map(part -> new UploadTarget(part.getUploadUrl(), new ByteRange(part.getFirstByte(), part.getLastByte())))
                .collect(Collectors.toList());
    }

    @Override
    public Mono<PublishHandle> transfer(PublishContext context, PublishHandle handle) {
        MediaItem item = context.getMedia().asItem();
        boolean image = !handle.isAwaitProcessing();

        return source(item).flatMap(source -> {
            UploadRequest.UploadRequestBuilder request = UploadRequest.builder()
                    .platform(Platform.LINKEDIN)
                    .source(source)
                    .targets(handle.getUploadTargets())
                    .contentType(image ? item.getContentType() : "application/octet-stream")
                    .requireCompletion(true)
                    .retryPolicy(properties.getLinkedin().retryPolicy())
                    .progressListener(context.getProgressListener());
            if (image) {
                request.header(HttpHeaders.AUTHORIZATION, "Bearer " + context.accessToken());
            }
            return uploadTransport.upload(request.build());
        }).flatMap(receipt -> {
            if (image) {
                return Mono.just(handle.advance(JobPhase.PROCESSING));
            }
            List<String> partIds = receipt.getEtags();
            return apiClient.finalizeVideoUpload(context.accessToken(), handle.getJobId(), handle.getUploadToken(), partIds)
                    .thenReturn(handle.advance(JobPhase.PROCESSING));
        });
    }

    @Override
    public Mono<PublishHandle> awaitReady(PublishContext context, PublishHandle handle) {
        if (!handle.isAwaitProcessing()) {
            return Mono.just(handle.advance(JobPhase.READY));
        }
        String videoUrn = handle.getJobId();
        return poller.awaitReady("LinkedIn video " + videoUrn,
                        properties.getLinkedin().pollPolicy(),
                        () -> apiClient.videoStatus(context.accessToken(), videoUrn).map(this::toJobStatus))
                .map(status -> handle.advance(JobPhase.READY));
    }

    @Override
    public Mono<PlatformPostRef> finalizePost(PublishContext context, PublishHandle handle) {
        return apiClient.createPost(context.accessToken(), postBody(context, authorUrn(context), handle.getJobId()))
                .map(urn -> {
                    log.info("LinkedIn post {} created for post {}", urn, context.getPost().getId());
                    return new PlatformPostRef(urn, "https://www.linkedin.com/feed/update/" + urn + "/");
                });
    }

    JobStatus<VideoStatus> toJobStatus(VideoStatus status) {
        String value = status.getStatus() == null ? "" : status.getStatus();
        return switch (value) {
            case STATUS_AVAILABLE -> JobStatus.ready(status);
            case STATUS_FAILED -> JobStatus.error(status.getProcessingFailureReason() != null
                    ? status.getProcessingFailureReason()
                    : "processing failed");
            case "WAITING_UPLOAD" -> JobStatus.uploading(value);
            default -> JobStatus.processing(value);
        };
    }

    Map<String, Object> postBody(PublishContext context, String author, String mediaUrn) {
        ComposedContent content = context.getContent();

        Map<String, Object> media = new HashMap<>();
        media.put("id", mediaUrn);
        if (content.getTitle() != null && !content.getTitle().isBlank()) {
            media.put("title", content.getTitle());
        }

        Map<String, Object> distribution = new HashMap<>();
        distribution.put("feedDistribution", "MAIN_FEED");
        distribution.put("targetEntities", List.of());
        distribution.put("thirdPartyDistributionChannels", List.of());

        Map<String, Object> body = new HashMap<>();
        body.put("author", author);
        body.put("commentary", content.getCaption() != null ? content.getCaption() : "");
        body.put("visibility", visibility(context.getPost().getVisibility()));
        body.put("distribution", distribution);
        body.put("content", Map.of("media", media));
        body.put("lifecycleState", "PUBLISHED");
        body.put("isReshareDisabledByAuthor", false);
        return body;
    }

    private String visibility(Visibility visibility) {
        if (visibility == null) {
            return "PUBLIC";
        }
        return switch (visibility) {
            case PUBLIC, UNLISTED -> "PUBLIC";
            case FOLLOWERS, PRIVATE -> "CONNECTIONS";
        };
    }

    private String authorUrn(PublishContext context) {
        String urn = context.getCredential().metadataAs(LinkedInMetadata.class).authorUrn();
        if (urn == null || urn.isBlank()) {
            throw new ValidationException("LinkedIn account has no person or organization URN");
        }
        return urn;
    }

    private Mono<MediaSource> source(MediaItem item) {
        return Mono.fromCallable(() -> mediaLocator.source(item))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
