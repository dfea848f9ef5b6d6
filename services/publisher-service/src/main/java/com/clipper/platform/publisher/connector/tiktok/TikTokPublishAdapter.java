package com.clipper.platform.publisher.connector.tiktok;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.PlatformPostRef;
import com.clipper.platform.publisher.connector.PublishAdapter;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.connector.PublishHandle;
import com.clipper.platform.publisher.connector.tiktok.dto.CreatorInfo;
import com.clipper.platform.publisher.connector.tiktok.dto.PublishInitData;
import com.clipper.platform.publisher.connector.tiktok.dto.PublishStatusData;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.MediaItem;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.MediaKind;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.model.Visibility;
import com.clipper.platform.publisher.polling.AsyncJobPoller;
import com.clipper.platform.publisher.polling.JobPhase;
import com.clipper.platform.publisher.polling.JobStatus;
import com.clipper.platform.publisher.storage.MediaLocator;
import com.clipper.platform.publisher.transport.ChunkPlan;
import com.clipper.platform.publisher.transport.MediaSource;
import com.clipper.platform.publisher.transport.UploadRequest;
import com.clipper.platform.publisher.transport.UploadTarget;
import com.clipper.platform.publisher.transport.UploadTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * TikTok Direct Post.
 *
 * Flow:
 * 1. Query creator info (privacy options, interaction locks, max duration)
 * 2. Initialize the post: FILE_UPLOAD when the video is in our storage, PULL_FROM_URL otherwise.
 *    Photo posts always go through /content/init/ with image URLs.
 * 3. PUT the video chunks to the upload URL (FILE_UPLOAD only)
 * 4. Poll /status/fetch/ until PUBLISH_COMPLETE
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TikTokPublishAdapter implements PublishAdapter {

    static final int MAX_PHOTO_IMAGES = 35;
    static final int MAX_PHOTO_TITLE_LENGTH = 90;
    static final String SELF_ONLY = "SELF_ONLY";

    private static final String STATUS_COMPLETE = "PUBLISH_COMPLETE";
    private static final String STATUS_INBOX = "SEND_TO_USER_INBOX";
    private static final String STATUS_FAILED = "FAILED";

    private final TikTokApiClient apiClient;
    private final UploadTransport uploadTransport;
    private final MediaLocator mediaLocator;
    private final AsyncJobPoller poller;
    private final PublishingProperties properties;

    @Override
    public Platform getPlatform() {
        return Platform.TIKTOK;
    }

    @Override
    public void validate(MediaAsset media, ComposedContent content) {
        switch (media.getKind()) {
            case VIDEO, IMAGE -> {
            }
            case CAROUSEL -> {
                int count = media.carouselSize();
                if (count < 1 || count > MAX_PHOTO_IMAGES) {
                    throw new ValidationException("TikTok photo posts need 1 to " + MAX_PHOTO_IMAGES
                            + " images, got " + count);
                }
                if (media.getCarouselItems().stream().anyMatch(MediaItem::isVideo)) {
                    throw new ValidationException("TikTok photo posts cannot contain videos");
                }
            }
            case STORY -> throw new ValidationException("TikTok does not support stories");
        }
    }

    @Override
    public Mono<PublishHandle> initiate(PublishContext context) {
        validate(context.getMedia(), context.getContent());

        return apiClient.queryCreatorInfo(context.accessToken())
                .flatMap(creator -> {
                    String privacyLevel = choosePrivacyLevel(context.getPost().getVisibility(),
                            creator.getPrivacyLevelOptions());
                    log.info("Initializing TikTok {} post for {} with privacy {}", context.getMedia().getKind(),
                            context.getPost().getId(), privacyLevel);

                    Mono<PublishHandle> handle = context.getMedia().getKind() == MediaKind.VIDEO
                            ? initVideo(context, creator, privacyLevel)
                            : initPhoto(context, creator, privacyLevel);
                    return handle.map(h -> h.toBuilder()
                            .creatorUsername(creator.getCreatorUsername() != null
                                    ? creator.getCreatorUsername()
                                    : context.getCredential().getUsername())
                            .build());
                });
    }

    private Mono<PublishHandle> initVideo(PublishContext context, CreatorInfo creator, String privacyLevel) {
        MediaAsset media = context.getMedia();
        checkDuration(media, creator);
        Map<String, Object> postInfo = videoPostInfo(context, creator, privacyLevel);
        MediaItem item = media.asItem();

        if (!mediaLocator.isStored(item)) {
            return publicUrl(item)
                    .flatMap(url -> {
                        Map<String, Object> body = new HashMap<>();
                        body.put("post_info", postInfo);
                        body.put("source_info", Map.of("source", "PULL_FROM_URL", "video_url", url));
                        return apiClient.initVideo(context.accessToken(), body);
                    })
                    .map(data -> handle(data, List.of()));
        }

        return source(item).flatMap(source -> {
            PublishingProperties.PlatformSettings settings = properties.getTiktok();
            ChunkPlan plan = ChunkPlan.withThreshold(source.size(), settings.getSingleChunkLimit().toBytes(),
                    settings.getChunkSize().toBytes());
            Map<String, Object> body = new HashMap<>();
            body.put("post_info", postInfo);
            body.put("source_info", fileUploadSourceInfo(plan));
            return apiClient.initVideo(context.accessToken(), body)
                    .flatMap(data -> data.getUploadUrl() == null
                            ? Mono.error(new ApiException("TikTok returned no upload_url for a file upload"))
                            : Mono.just(handle(data, UploadTarget.forPlan(data.getUploadUrl(), plan))));
        });
    }

    private Mono<PublishHandle> initPhoto(PublishContext context, CreatorInfo creator, String privacyLevel) {
        MediaAsset media = context.getMedia();
        List<MediaItem> items = media.getKind() == MediaKind.CAROUSEL ? media.getCarouselItems() : List.of(media.asItem());

        return Flux.fromIterable(items)
                .concatMap(this::publicUrl)
                .collectList()
                .flatMap(urls -> apiClient.initContent(context.accessToken(),
                        photoPostBody(context, creator, privacyLevel, urls)))
                .map(data -> handle(data, List.of()));
    }

    private PublishHandle handle(PublishInitData data, List<UploadTarget> targets) {
        return PublishHandle.builder()
                .platform(Platform.TIKTOK)
                .phase(targets.isEmpty() ? JobPhase.PROCESSING : JobPhase.UPLOADING)
                .jobId(data.getPublishId())
                .uploadUrl(data.getUploadUrl())
                .uploadTargets(targets)
                .awaitProcessing(true)
                .build();
    }

    @Override
    public Mono<PublishHandle> transfer(PublishContext context, PublishHandle handle) {
        if (handle.getUploadTargets().isEmpty()) {
            // PULL_FROM_URL: TikTok downloads the media itself
            return Mono.just(handle.advance(JobPhase.PROCESSING));
        }
        MediaItem item = context.getMedia().asItem();
        return source(item).flatMap(source -> uploadTransport.upload(UploadRequest.builder()
                        .platform(Platform.TIKTOK)
                        .source(source)
                        .targets(handle.getUploadTargets())
                        .contentType(item.getContentType())
                        .contentRange(true)
                        .requireCompletion(true)
                        .retryPolicy(properties.getTiktok().retryPolicy())
                        .progressListener(context.getProgressListener())
                        .build()))
                .map(receipt -> {
                    log.info("TikTok upload complete for publish {}", handle.getJobId());
                    return handle.advance(JobPhase.PROCESSING);
                });
    }

    @Override
    public Mono<PublishHandle> awaitReady(PublishContext context, PublishHandle handle) {
        String publishId = handle.getJobId();
        return poller.awaitReady("TikTok publish " + publishId,
                        properties.getTiktok().pollPolicy(),
                        () -> apiClient.fetchStatus(context.accessToken(), publishId).map(this::toJobStatus))
                .map(status -> handle.toBuilder()
                        .phase(JobPhase.READY)
                        .resourceId(status.firstPublicPostId())
                        .build());
    }

    @Override
    public Mono<PlatformPostRef> finalizePost(PublishContext context, PublishHandle handle) {
        // Direct Post goes live once processing completes
        String publicId = handle.getResourceId();
        String username = handle.getCreatorUsername();
        String profileUrl = username != null ? "https://www.tiktok.com/@" + username : "https://www.tiktok.com/";
        if (publicId == null) {
            // Private posts and inbox drafts have no public id yet
            return Mono.just(new PlatformPostRef(handle.getJobId(), profileUrl));
        }
        return Mono.just(new PlatformPostRef(publicId, profileUrl + "/video/" + publicId));
    }

    JobStatus<PublishStatusData> toJobStatus(PublishStatusData data) {
        String status = data.getStatus() == null ? "" : data.getStatus();
        return switch (status) {
            case STATUS_COMPLETE, STATUS_INBOX -> JobStatus.ready(data);
            case STATUS_FAILED -> JobStatus.error(data.getFailReason() != null ? data.getFailReason() : "unknown reason");
            case "PROCESSING_UPLOAD" -> JobStatus.uploading(status);
            default -> JobStatus.processing(status);
        };
    }

    /**
     * The requested level when the creator may use it, otherwise SELF_ONLY, otherwise the first
     * option TikTok offers.
     */
    static String choosePrivacyLevel(Visibility visibility, List<String> options) {
        if (options == null || options.isEmpty()) {
            throw new ApiException("TikTok returned no privacy level options for the creator");
        }
        for (String requested : requestedPrivacyLevels(visibility)) {
            if (options.contains(requested)) {
                return requested;
            }
        }
        return options.contains(SELF_ONLY) ? SELF_ONLY : options.get(0);
    }

    private static List<String> requestedPrivacyLevels(Visibility visibility) {
        if (visibility == null) {
            return List.of("PUBLIC_TO_EVERYONE");
        }
        return switch (visibility) {
            case PUBLIC -> List.of("PUBLIC_TO_EVERYONE");
            case FOLLOWERS -> List.of("FOLLOWER_OF_CREATOR", "MUTUAL_FOLLOW_FRIENDS");
            case UNLISTED, PRIVATE -> List.of(SELF_ONLY);
        };
    }

    Map<String, Object> videoPostInfo(PublishContext context, CreatorInfo creator, String privacyLevel) {
        SocialPost post = context.getPost();
        Map<String, Object> postInfo = new HashMap<>();
        postInfo.put("title", context.getContent().getCaption());
        postInfo.put("privacy_level", privacyLevel);
        postInfo.put("disable_comment", post.isDisableComment() || Boolean.TRUE.equals(creator.getCommentDisabled()));
        postInfo.put("disable_duet", post.isDisableDuet() || Boolean.TRUE.equals(creator.getDuetDisabled()));
        postInfo.put("disable_stitch", post.isDisableStitch() || Boolean.TRUE.equals(creator.getStitchDisabled()));
        postInfo.put("video_cover_timestamp_ms", 1000);
        return postInfo;
    }

    /**
     * source_info for FILE_UPLOAD. A video under the single-chunk limit goes up in one chunk whose
     * size is the whole video.
     */
    static Map<String, Object> fileUploadSourceInfo(ChunkPlan plan) {
        Map<String, Object> sourceInfo = new HashMap<>();
        sourceInfo.put("source", "FILE_UPLOAD");
        sourceInfo.put("video_size", plan.getTotalBytes());
        sourceInfo.put("chunk_size", plan.getChunkSize());
        sourceInfo.put("total_chunk_count", plan.getChunkCount());
        return sourceInfo;
    }

    Map<String, Object> photoPostBody(PublishContext context, CreatorInfo creator, String privacyLevel,
                                      List<String> imageUrls) {
        ComposedContent content = context.getContent();
        String title = content.getTitle() != null ? content.getTitle() : "";
        if (title.length() > MAX_PHOTO_TITLE_LENGTH) {
            title = title.substring(0, MAX_PHOTO_TITLE_LENGTH);
        }

        Map<String, Object> postInfo = new HashMap<>();
        postInfo.put("title", title);
        postInfo.put("description", content.getCaption() != null ? content.getCaption() : "");
        postInfo.put("privacy_level", privacyLevel);
        postInfo.put("disable_comment",
                context.getPost().isDisableComment() || Boolean.TRUE.equals(creator.getCommentDisabled()));
        postInfo.put("auto_add_music", true);

        Map<String, Object> sourceInfo = new HashMap<>();
        sourceInfo.put("source", "PULL_FROM_URL");
        sourceInfo.put("photo_images", imageUrls);
        sourceInfo.put("photo_cover_index", 0);

        Map<String, Object> body = new HashMap<>();
        body.put("post_info", postInfo);
        body.put("source_info", sourceInfo);
        body.put("post_mode", "DIRECT_POST");
        body.put("media_type", "PHOTO");
        return body;
    }

    private void checkDuration(MediaAsset media, CreatorInfo creator) {
        Integer max = creator.getMaxVideoPostDurationSec();
        if (max != null && media.getDurationSeconds() != null && media.getDurationSeconds() > max) {
            throw new ValidationException("Video is " + media.getDurationSeconds().intValue()
                    + "s long, TikTok allows this creator at most " + max + "s");
        }
    }

    private Mono<String> publicUrl(MediaItem item) {
        return Mono.fromCallable(() -> mediaLocator.publicUrl(item))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<MediaSource> source(MediaItem item) {
        return Mono.fromCallable(() -> mediaLocator.source(item))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
