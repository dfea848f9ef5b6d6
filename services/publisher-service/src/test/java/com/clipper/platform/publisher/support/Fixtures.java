package com.clipper.platform.publisher.support;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.config.StorageProperties;
import com.clipper.platform.publisher.connector.PlatformPostRef;
import com.clipper.platform.publisher.connector.PublishAdapter;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.credential.AccessCredential;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.MediaItem;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.entity.metadata.AccountMetadata;
import com.clipper.platform.publisher.model.MediaKind;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.model.PostStatus;
import com.clipper.platform.publisher.service.ContentAdapterService;
import com.clipper.platform.publisher.storage.MediaLocator;
import com.clipper.platform.publisher.storage.ObjectStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Builders for the entities and contexts the publish tests share.
 */
public final class Fixtures {

    public static final String SECRET_KEY = Base64.getEncoder().encodeToString("0123456789abcdef0123456789abcdef".getBytes());

    private Fixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    /**
     * Default settings with zero backoff and millisecond polling, so retries and polls do not slow
     * tests down.
     */
    public static PublishingProperties fastProperties() {
        PublishingProperties properties = new PublishingProperties();
        for (PublishingProperties.PlatformSettings settings : List.of(properties.getInstagram(),
                properties.getYoutube(), properties.getTiktok(), properties.getLinkedin())) {
            settings.setPollInterval(Duration.ofMillis(1));
            settings.setRetryBackoff(Duration.ofMillis(1));
            settings.setMaxRetryBackoff(Duration.ofMillis(2));
        }
        return properties;
    }

    public static SocialPost post(Platform platform) {
        return SocialPost.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .platform(platform)
                .mediaId(UUID.randomUUID())
                .title("Launch day")
                .caption("We shipped it")
                .hashtags(new ArrayList<>(List.of("launch", "#clipper")))
                .status(PostStatus.DRAFT)
                .build();
    }

    public static MediaAsset video(String storageKey, long sizeBytes, double durationSeconds, int width, int height) {
        return MediaAsset.builder()
                .id(UUID.randomUUID())
                .kind(MediaKind.VIDEO)
                .storageKey(storageKey)
                .contentType("video/mp4")
                .sizeBytes(sizeBytes)
                .durationSeconds(durationSeconds)
                .width(width)
                .height(height)
                .build();
    }

    public static MediaAsset image(String storageKey) {
        return MediaAsset.builder()
                .id(UUID.randomUUID())
                .kind(MediaKind.IMAGE)
                .storageKey(storageKey)
                .contentType("image/jpeg")
                .sizeBytes(1024L)
                .build();
    }

    public static MediaAsset carousel(List<MediaItem> items) {
        return MediaAsset.builder()
                .id(UUID.randomUUID())
                .kind(MediaKind.CAROUSEL)
                .carouselItems(new ArrayList<>(items))
                .build();
    }

    public static MediaItem imageItem(String storageKey) {
        return MediaItem.builder().storageKey(storageKey).contentType("image/jpeg").build();
    }

    public static MediaItem videoItem(String storageKey) {
        return MediaItem.builder().storageKey(storageKey).contentType("video/mp4").build();
    }

    public static List<MediaItem> imageItems(int count) {
        List<MediaItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(imageItem("media/img-" + i + ".jpg"));
        }
        return items;
    }

    public static AccessCredential credential(Platform platform, AccountMetadata metadata) {
        return AccessCredential.builder()
                .accountId(UUID.randomUUID())
                .platform(platform)
                .accessToken("token-" + platform.name().toLowerCase())
                .username("clipper_creator")
                .metadata(metadata)
                .build();
    }

    /**
     * Runs the four adapter phases in order, the way the orchestrator does.
     */
    public static Mono<PlatformPostRef> publish(PublishAdapter adapter, PublishContext context) {
        return Mono.defer(() -> adapter.initiate(context))
                .flatMap(handle -> adapter.transfer(context, handle))
                .flatMap(handle -> adapter.awaitReady(context, handle))
                .flatMap(handle -> adapter.finalizePost(context, handle));
    }

    public static MediaLocator mediaLocator(ObjectStorage storage) {
        StorageProperties properties = new StorageProperties();
        properties.setPublicUrl("https://media.clipper.app");
        return new MediaLocator(storage, properties);
    }

    public static PublishContext context(SocialPost post, MediaAsset media, AccessCredential credential) {
        ComposedContent content = new ContentAdapterService().compose(post);
        return PublishContext.builder()
                .post(post)
                .media(media)
                .content(content)
                .credential(credential)
                .build();
    }
}
