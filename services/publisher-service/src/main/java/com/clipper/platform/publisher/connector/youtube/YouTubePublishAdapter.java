package com.clipper.platform.publisher.connector.youtube;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.PlatformPostRef;
import com.clipper.platform.publisher.connector.PublishAdapter;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.connector.PublishHandle;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.MediaItem;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.exception.RemoteErrors;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.MediaKind;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.polling.JobPhase;
import com.clipper.platform.publisher.service.ContentAdapterService;
import com.clipper.platform.publisher.storage.MediaLocator;
import com.clipper.platform.publisher.transport.ChunkPlan;
import com.clipper.platform.publisher.transport.MediaSource;
import com.clipper.platform.publisher.transport.UploadRequest;
import com.clipper.platform.publisher.transport.UploadTarget;
import com.clipper.platform.publisher.transport.UploadTransport;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * YouTube upload through the resumable protocol of the Data API v3.
 * The metadata POST opens a session and returns its upload URI; the video is then PUT in
 * fixed-size chunks with Content-Range. The final chunk returns the video resource, so there is
 * no separate publish step. Privacy and scheduling are fixed when the session is opened.
 *
 * API Documentation: https://developers.google.com/youtube/v3/guides/using_resumable_upload_protocol
 */
@Service
@Slf4j
public class YouTubePublishAdapter implements PublishAdapter {

    static final String UPLOAD_URL = "https://www.googleapis.com/upload/youtube/v3/videos"
            + "?uploadType=resumable&part=snippet,status";

    private static final int SHORTS_MAX_DURATION_SECONDS = 60;
    private static final String PEOPLE_AND_BLOGS_CATEGORY = "22";
    private static final String DEFAULT_TITLE = "Untitled video";

    private final WebClient.Builder webClientBuilder;
    private final UploadTransport uploadTransport;
    private final MediaLocator mediaLocator;
    private final ContentAdapterService contentAdapterService;
    private final ObjectMapper objectMapper;
    private final PublishingProperties properties;
    private final Clock clock;

    @Autowired
    public YouTubePublishAdapter(WebClient.Builder webClientBuilder, UploadTransport uploadTransport,
                                 MediaLocator mediaLocator, ContentAdapterService contentAdapterService,
                                 ObjectMapper objectMapper, PublishingProperties properties) {
        this(webClientBuilder, uploadTransport, mediaLocator, contentAdapterService, objectMapper, properties,
                Clock.systemUTC());
    }

    YouTubePublishAdapter(WebClient.Builder webClientBuilder, UploadTransport uploadTransport,
                          MediaLocator mediaLocator, ContentAdapterService contentAdapterService,
                          ObjectMapper objectMapper, PublishingProperties properties, Clock clock) {
        this.webClientBuilder = webClientBuilder;
        this.uploadTransport = uploadTransport;
        this.mediaLocator = mediaLocator;
        this.contentAdapterService = contentAdapterService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE;
    }

    @Override
    public void validate(MediaAsset media, ComposedContent content) {
        if (media.getKind() != MediaKind.VIDEO) {
            throw new ValidationException("YouTube only accepts video uploads, got " + media.getKind());
        }
        if (media.getStorageKey() == null) {
            throw new ValidationException("YouTube uploads need the video in object storage");
        }
    }

    @Override
    public Mono<PublishHandle> initiate(PublishContext context) {
        validate(context.getMedia(), context.getContent());
        MediaItem item = context.getMedia().asItem();
        boolean isShort = isShort(context.getMedia(), context.getContent());
        Map<String, Object> metadata = videoMetadata(context, isShort);

        log.info("Opening YouTube upload session for post {} (short: {})", context.getPost().getId(), isShort);

        return source(item).flatMap(source -> {
            Mono<String> call = webClientBuilder.build().post()
                    .uri(UPLOAD_URL)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + context.accessToken())
                    .header("X-Upload-Content-Type", item.getContentType())
                    .header("X-Upload-Content-Length", String.valueOf(source.size()))
                    .contentType(new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8))
                    .bodyValue(metadata)
                    .exchangeToMono(this::uploadLocation);
            return RemoteErrors.guard(Platform.YOUTUBE, properties.getCallTimeout(), call);
        }).map(uploadUrl -> PublishHandle.builder()
                .platform(Platform.YOUTUBE)
                .phase(JobPhase.UPLOADING)
                .jobId(uploadUrl)
                .uploadUrl(uploadUrl)
                .shortForm(isShort)
                .build());
    }

    private Mono<String> uploadLocation(ClientResponse response) {
        if (response.statusCode().is2xxSuccessful()) {
            String location = response.headers().asHttpHeaders().getFirst(HttpHeaders.LOCATION);
            return response.releaseBody().then(location != null
                    ? Mono.just(location)
                    : Mono.error(new ApiException("YouTube did not return an upload URI")));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(translateError(response.statusCode().value(), body)));
    }

    @Override
    public Mono<PublishHandle> transfer(PublishContext context, PublishHandle handle) {
        MediaItem item = context.getMedia().asItem();
        PublishingProperties.PlatformSettings settings = properties.getYoutube();

        return source(item).flatMap(source -> {
            ChunkPlan plan = ChunkPlan.of(source.size(), settings.getChunkSize().toBytes());
            UploadRequest request = UploadRequest.builder()
                    .platform(Platform.YOUTUBE)
                    .source(source)
                    .targets(UploadTarget.forPlan(handle.getUploadUrl(), plan))
                    .contentType(item.getContentType())
                    .contentRange(true)
                    .requireCompletion(true)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + context.accessToken())
                    .retryPolicy(settings.retryPolicy())
                    .progressListener(context.getProgressListener())
                    .build();
            return uploadTransport.upload(request);
        }).flatMap(receipt -> videoId(receipt.getFinalBody()))
                .map(videoId -> {
                    log.info("YouTube upload complete for post {}, video {}", context.getPost().getId(), videoId);
                    return handle.toBuilder()
                            .phase(JobPhase.PROCESSING)
                            .resourceId(videoId)
                            .build();
                });
    }

    @Override
    public Mono<PublishHandle> awaitReady(PublishContext context, PublishHandle handle) {
        // The finished upload already is the published video; transcoding happens on YouTube's side
        return Mono.just(handle.advance(JobPhase.READY));
    }

    @Override
    public Mono<PlatformPostRef> finalizePost(PublishContext context, PublishHandle handle) {
        String videoId = handle.getResourceId();
        String url = handle.isShortForm()
                ? "https://www.youtube.com/shorts/" + videoId
                : "https://www.youtube.com/watch?v=" + videoId;
        return Mono.just(new PlatformPostRef(videoId, url));
    }

    /**
     * A Short is a portrait video of at most 60 seconds, or any video explicitly marked #Shorts.
     */
    boolean isShort(MediaAsset media, ComposedContent content) {
        if (contentAdapterService.hasShortsMarker(content.getTitle())
                || contentAdapterService.hasShortsMarker(content.getDescription())) {
            return true;
        }
        return media.getDurationSeconds() != null
                && media.getDurationSeconds() <= SHORTS_MAX_DURATION_SECONDS
                && media.isPortrait();
    }

    Map<String, Object> videoMetadata(PublishContext context, boolean isShort) {
        ComposedContent content = context.getContent();
        SocialPost post = context.getPost();
        int maxTitle = Platform.YOUTUBE.getMaxTitleLength();

        String title = content.getTitle() == null || content.getTitle().isBlank() ? DEFAULT_TITLE : content.getTitle();
        List<String> tags = new ArrayList<>(content.getTags());
        if (isShort) {
            title = contentAdapterService.ensureShortsTag(title, maxTitle);
            if (tags.stream().noneMatch("Shorts"::equalsIgnoreCase)) {
                tags.add("Shorts");
            }
        }

        Map<String, Object> snippet = new HashMap<>();
        snippet.put("title", title);
        snippet.put("description", content.getDescription() != null ? content.getDescription() : "");
        snippet.put("tags", tags);
        snippet.put("categoryId", PEOPLE_AND_BLOGS_CATEGORY);

        Map<String, Object> status = new HashMap<>();
        status.put("selfDeclaredMadeForKids", false);
        OffsetDateTime scheduledFor = post.getScheduledFor();
        if (scheduledFor != null && scheduledFor.isAfter(OffsetDateTime.now(clock))) {
            // Scheduled videos must stay private until YouTube publishes them
            status.put("privacyStatus", "private");
            status.put("publishAt", scheduledFor.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } else {
            status.put("privacyStatus", privacyStatus(post));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("snippet", snippet);
        body.put("status", status);
        return body;
    }

    private String privacyStatus(SocialPost post) {
        if (post.getVisibility() == null) {
            return "public";
        }
        return switch (post.getVisibility()) {
            case PUBLIC -> "public";
            case UNLISTED -> "unlisted";
            case FOLLOWERS, PRIVATE -> "private";
        };
    }

    private Mono<MediaSource> source(MediaItem item) {
        return Mono.fromCallable(() -> mediaLocator.source(item))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<String> videoId(String body) {
        return Mono.fromCallable(() -> objectMapper.readValue(body, YouTubeVideoResource.class))
                .onErrorMap(JsonProcessingException.class,
                        e -> new ApiException("YouTube returned an unreadable video resource: " + e.getOriginalMessage()))
                .flatMap(video -> video.getId() != null
                        ? Mono.just(video.getId())
                        : Mono.error(new ApiException("YouTube returned no video id")));
    }

    PublishException translateError(int status, String body) {
        String message = body;
        String reason = null;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.hasNonNull("message")) {
                message = error.get("message").asText();
            }
            reason = error.path("errors").path(0).path("reason").asText(null);
        } catch (JsonProcessingException e) {
            log.debug("YouTube error body is not JSON: {}", e.getOriginalMessage());
        }
        if (status == 401 || "authError".equals(reason)) {
            return new AuthException("YouTube rejected the access token: " + message);
        }
        return RemoteErrors.fromStatus(Platform.YOUTUBE, status, message);
    }
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class YouTubeVideoResource {
    private String id;
    private String kind;
}
