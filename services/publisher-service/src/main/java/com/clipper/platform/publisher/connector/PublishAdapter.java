package com.clipper.platform.publisher.connector;

import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.model.Platform;
import reactor.core.publisher.Mono;

/**
 * Common contract of the platform publishers. A publish runs the phases strictly in order:
 * {@code initiate -> transfer -> awaitReady -> finalizePost}; {@code finalizePost} is only
 * called with a handle in phase {@code READY}.
 * Implementations: InstagramPublishAdapter, YouTubePublishAdapter, TikTokPublishAdapter,
 * LinkedInPublishAdapter
 */
public interface PublishAdapter {

    /**
     * Get the platform this adapter publishes to
     */
    Platform getPlatform();

    /**
     * Reject media or content the platform cannot take. Runs before any network call.
     */
    default void validate(MediaAsset media, ComposedContent content) {
    }

    /**
     * Open the remote job: create containers, open an upload session or register the upload
     */
    Mono<PublishHandle> initiate(PublishContext context);

    /**
     * Move the media bytes, or let the platform pull them by URL
     */
    Mono<PublishHandle> transfer(PublishContext context, PublishHandle handle);

    /**
     * Wait until the platform finished processing the media
     */
    Mono<PublishHandle> awaitReady(PublishContext context, PublishHandle handle);

    /**
     * Make the post live and return its id and URL
     */
    Mono<PlatformPostRef> finalizePost(PublishContext context, PublishHandle handle);
}
