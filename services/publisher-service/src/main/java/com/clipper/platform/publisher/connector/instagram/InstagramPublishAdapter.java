package com.clipper.platform.publisher.connector.instagram;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.PlatformPostRef;
import com.clipper.platform.publisher.connector.PublishAdapter;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.connector.PublishHandle;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.MediaItem;
import com.clipper.platform.publisher.entity.metadata.InstagramMetadata;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.MediaKind;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.polling.AsyncJobPoller;
import com.clipper.platform.publisher.polling.JobPhase;
import com.clipper.platform.publisher.polling.JobStatus;
import com.clipper.platform.publisher.storage.MediaLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Instagram publishing through media containers: create container(s), wait for video
 * containers to finish processing, then {@code media_publish}. Instagram pulls the media itself
 * from a public URL, so there is no byte transfer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstagramPublishAdapter implements PublishAdapter {

    static final int MIN_CAROUSEL_ITEMS = 2;
    static final int MAX_CAROUSEL_ITEMS = 10;

    private final InstagramGraphClient graphClient;
    private final MediaLocator mediaLocator;
    private final AsyncJobPoller poller;
    private final PublishingProperties properties;

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public void validate(MediaAsset media, ComposedContent content) {
        if (media.getKind() == MediaKind.CAROUSEL) {
            int count = media.carouselSize();
            if (count < MIN_CAROUSEL_ITEMS || count > MAX_CAROUSEL_ITEMS) {
                throw new ValidationException("Instagram carousels need " + MIN_CAROUSEL_ITEMS + " to "
                        + MAX_CAROUSEL_ITEMS + " items, got " + count);
            }
        }
    }

    @Override
    public Mono<PublishHandle> initiate(PublishContext context) {
        MediaAsset media = context.getMedia();
        validate(media, context.getContent());
        String igUserId = businessAccountId(context);
        String caption = context.getContent().getCaption();

        log.info("Creating Instagram {} container for post {}", media.getKind(), context.getPost().getId());

        Mono<PublishHandle> handle = switch (media.getKind()) {
            case IMAGE -> publicUrl(media.asItem())
                    .flatMap(url -> create(context, igUserId, imageParams(url, caption)))
                    .map(id -> handle(id, false));
            case VIDEO -> publicUrl(media.asItem())
                    .flatMap(url -> create(context, igUserId, reelParams(url, caption)))
                    .map(id -> handle(id, true));
            case STORY -> {
                MediaItem item = media.asItem();
                yield publicUrl(item)
                        .flatMap(url -> create(context, igUserId, storyParams(item, url)))
                        .map(id -> handle(id, item.isVideo()));
            }
            case CAROUSEL -> createCarousel(context, igUserId, caption)
                    .map(id -> handle(id, true));
        };
        return handle;
    }

    /**
     * Children carry no caption. Video children must finish processing before the parent container
     * can reference them.
     */
    private Mono<String> createCarousel(PublishContext context, String igUserId, String caption) {
        return Flux.fromIterable(context.getMedia().getCarouselItems())
                .concatMap(item -> publicUrl(item)
                        .flatMap(url -> create(context, igUserId, carouselChildParams(item, url)))
                        .flatMap(childId -> item.isVideo() ? awaitContainer(context, childId) : Mono.just(childId)))
                .collectList()
                .flatMap(childIds -> {
                    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
                    params.add("media_type", "CAROUSEL");
                    params.add("children", String.join(",", childIds));
                    addCaption(params, caption);
                    return create(context, igUserId, params);
                });
    }

    @Override
    public Mono<PublishHandle> transfer(PublishContext context, PublishHandle handle) {
        // Instagram fetches the media from the container's URL
        return Mono.just(handle.advance(JobPhase.PROCESSING));
    }

    @Override
    public Mono<PublishHandle> awaitReady(PublishContext context, PublishHandle handle) {
        if (!handle.isAwaitProcessing()) {
            return Mono.just(handle.advance(JobPhase.READY));
        }
        return awaitContainer(context, handle.getJobId())
                .map(id -> handle.advance(JobPhase.READY));
    }

    @Override
    public Mono<PlatformPostRef> finalizePost(PublishContext context, PublishHandle handle) {
        String igUserId = businessAccountId(context);
        String token = context.accessToken();

        return graphClient.publishContainer(igUserId, handle.getJobId(), token)
                .flatMap(mediaId -> graphClient.permalink(mediaId, token)
                        .onErrorResume(PublishException.class, e -> {
                            log.warn("Published Instagram media {} but could not fetch its permalink: {}",
                                    mediaId, e.getMessage());
                            return Mono.empty();
                        })
                        .defaultIfEmpty("https://www.instagram.com/p/" + mediaId + "/")
                        .map(permalink -> new PlatformPostRef(mediaId, permalink)));
    }

    private Mono<String> awaitContainer(PublishContext context, String containerId) {
        return poller.awaitReady("Instagram container " + containerId,
                properties.getInstagram().pollPolicy(),
                () -> graphClient.containerStatus(containerId, context.accessToken())
                        .map(status -> toJobStatus(containerId, status)));
    }

    JobStatus<String> toJobStatus(String containerId, GraphContainerStatus status) {
        String code = status.getStatusCode() == null ? "IN_PROGRESS" : status.getStatusCode();
        return switch (code) {
            case "FINISHED", "PUBLISHED" -> JobStatus.ready(containerId);
            case "ERROR", "EXPIRED" -> JobStatus.error(code + (status.getStatus() != null ? ": " + status.getStatus() : ""));
            default -> JobStatus.processing(code);
        };
    }

    private Mono<String> create(PublishContext context, String igUserId, MultiValueMap<String, String> params) {
        return graphClient.createContainer(igUserId, context.accessToken(), params);
    }

    private Mono<String> publicUrl(MediaItem item) {
        return Mono.fromCallable(() -> mediaLocator.publicUrl(item))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private PublishHandle handle(String containerId, boolean awaitProcessing) {
        return PublishHandle.builder()
                .platform(Platform.INSTAGRAM)
                .phase(JobPhase.UPLOADING)
                .jobId(containerId)
                .awaitProcessing(awaitProcessing)
                .build();
    }

    private String businessAccountId(PublishContext context) {
        String id = context.getCredential().metadataAs(InstagramMetadata.class).getInstagramBusinessAccountId();
        if (id == null || id.isBlank()) {
            throw new ValidationException("Instagram account has no linked business account id");
        }
        return id;
    }

    MultiValueMap<String, String> imageParams(String url, String caption) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("image_url", url);
        addCaption(params, caption);
        return params;
    }

    MultiValueMap<String, String> reelParams(String url, String caption) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("media_type", "REELS");
        params.add("video_url", url);
        // Reels appear in both the Reels tab and the feed
        params.add("share_to_feed", "true");
        addCaption(params, caption);
        return params;
    }

    MultiValueMap<String, String> storyParams(MediaItem item, String url) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("media_type", "STORIES");
        params.add(item.isVideo() ? "video_url" : "image_url", url);
        return params;
    }

    MultiValueMap<String, String> carouselChildParams(MediaItem item, String url) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("is_carousel_item", "true");
        if (item.isVideo()) {
            params.add("media_type", "VIDEO");
            params.add("video_url", url);
        } else {
            params.add("image_url", url);
        }
        return params;
    }

    private void addCaption(MultiValueMap<String, String> params, String caption) {
        if (caption != null && !caption.isBlank()) {
            params.add("caption", caption);
        }
    }
}
