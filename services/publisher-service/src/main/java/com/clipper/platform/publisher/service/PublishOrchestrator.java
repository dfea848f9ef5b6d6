package com.clipper.platform.publisher.service;

import com.clipper.platform.publisher.connector.PlatformPostRef;
import com.clipper.platform.publisher.connector.PublishAdapter;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.credential.AccessCredential;
import com.clipper.platform.publisher.credential.CredentialVault;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.dto.PublishOutcome;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.ProcessingFailureException;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.model.PostStatus;
import com.clipper.platform.publisher.polling.JobPhase;
import com.clipper.platform.publisher.repository.MediaAssetRepository;
import com.clipper.platform.publisher.repository.SocialAccountRepository;
import com.clipper.platform.publisher.repository.SocialPostRepository;
import com.clipper.platform.publisher.transport.UploadProgressListener;
import lombok.Value;
import lombok.With;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one post through its platform adapter and records the result on the post.
 * <p>
 * A post is claimed by moving it to {@code PUBLISHING} with a conditional update before anything
 * else happens, so only one trigger can publish it. A rejected token gets one refresh and one
 * retry; a second rejection deactivates the account. Whatever happens, the caller receives a
 * {@link PublishOutcome}.
 */
@Service
@Slf4j
public class PublishOrchestrator {

    static final String CANCELLED_MESSAGE = "Publish cancelled before completion";

    private final SocialPostRepository postRepository;
    private final SocialAccountRepository accountRepository;
    private final MediaAssetRepository mediaRepository;
    private final CredentialVault vault;
    private final ContentAdapterService contentAdapterService;
    private final Map<Platform, PublishAdapter> adapters = new EnumMap<>(Platform.class);
    private final Clock clock;
    private final Scheduler persistenceScheduler;

    @Autowired
    public PublishOrchestrator(SocialPostRepository postRepository, SocialAccountRepository accountRepository,
                               MediaAssetRepository mediaRepository, CredentialVault vault,
                               ContentAdapterService contentAdapterService, List<PublishAdapter> adapters) {
        this(postRepository, accountRepository, mediaRepository, vault, contentAdapterService, adapters,
                Clock.systemUTC(), Schedulers.boundedElastic());
    }

    PublishOrchestrator(SocialPostRepository postRepository, SocialAccountRepository accountRepository,
                        MediaAssetRepository mediaRepository, CredentialVault vault,
                        ContentAdapterService contentAdapterService, List<PublishAdapter> adapters,
                        Clock clock, Scheduler persistenceScheduler) {
        this.postRepository = postRepository;
        this.accountRepository = accountRepository;
        this.mediaRepository = mediaRepository;
        this.vault = vault;
        this.contentAdapterService = contentAdapterService;
        this.clock = clock;
        this.persistenceScheduler = persistenceScheduler;
        adapters.forEach(adapter -> this.adapters.put(adapter.getPlatform(), adapter));
    }

    public Mono<PublishOutcome> publish(UUID postId) {
        return publish(postId, UploadProgressListener.NONE);
    }

    public Mono<PublishOutcome> publish(UUID postId, UploadProgressListener progressListener) {
        return Mono.fromCallable(() -> postRepository.findById(postId))
                .subscribeOn(persistenceScheduler)
                .flatMap(post -> post
                        .map(found -> publish(found, progressListener))
                        .orElseGet(() -> Mono.just(PublishOutcome.failure(postId, null,
                                new ValidationException("Post not found: " + postId)))))
                .onErrorResume(error -> {
                    log.error("Publish of post {} failed before it started: {}", postId, error.getMessage(), error);
                    return Mono.just(PublishOutcome.failure(postId, null, error));
                });
    }

    private Mono<PublishOutcome> publish(SocialPost post, UploadProgressListener progressListener) {
        if (post.getStatus() == PostStatus.PUBLISHED) {
            log.info("Post {} is already published as {}, nothing to do", post.getId(), post.getPlatformPostId());
            return Mono.just(PublishOutcome.published(post));
        }
        if (!post.getStatus().isPublishable()) {
            return Mono.just(PublishOutcome.failure(post, alreadyInProgress(post)));
        }

        PublishAttempt attempt = new PublishAttempt();
        return claim(post, attempt).flatMap(claimed -> {
                    if (!claimed) {
                        return Mono.just(PublishOutcome.failure(post, alreadyInProgress(post)));
                    }
                    log.info("Publishing post {} to {}", post.getId(), post.getPlatform().getDisplayName());
                    return prepare(post, progressListener)
                            .flatMap(this::execute)
                            .switchIfEmpty(Mono.error(() -> new ApiException(post.getPlatform().getDisplayName()
                                    + " returned no post for " + post.getId())))
                            .flatMap(ref -> markPublished(post, ref))
                            .onErrorResume(error -> markFailed(post, error));
                })
                .doOnCancel(() -> {
                    log.warn("Publish of post {} was cancelled", post.getId());
                    if (attempt.cancel()) {
                        releaseCancelled(post);
                    }
                });
    }

    private ValidationException alreadyInProgress(SocialPost post) {
        return new ValidationException("Post " + post.getId() + " is already being published");
    }

    private Mono<Boolean> claim(SocialPost post, PublishAttempt attempt) {
        return Mono.fromCallable(() -> {
                    boolean claimed = postRepository.transitionStatus(post.getId(), PostStatus.PUBLISHABLE,
                            PostStatus.PUBLISHING) == 1;
                    if (claimed && attempt.claim()) {
                        // the subscriber left while the update was running
                        releaseCancelled(post);
                    }
                    return claimed;
                })
                .subscribeOn(persistenceScheduler)
                .doOnNext(claimed -> {
                    if (claimed) {
                        post.setStatus(PostStatus.PUBLISHING);
                        post.setErrorMessage(null);
                    } else {
                        log.info("Post {} was claimed by another publish, skipping", post.getId());
                    }
                });
    }

    private Mono<PublishJob> prepare(SocialPost post, UploadProgressListener progressListener) {
        PublishAdapter adapter = adapters.get(post.getPlatform());
        if (adapter == null) {
            return Mono.error(new ValidationException("No publisher for platform " + post.getPlatform()));
        }
        return Mono.fromCallable(() -> {
                    SocialAccount account = accountRepository
                            .findByUserIdAndPlatformAndActiveTrue(post.getUserId(), post.getPlatform())
                            .orElseThrow(() -> new ApiException("No connected " + post.getPlatform().getDisplayName()
                                    + " account for user " + post.getUserId()));
                    MediaAsset media = Optional.ofNullable(post.getMediaId())
                            .flatMap(mediaRepository::findById)
                            .orElseThrow(() -> new ValidationException("Media " + post.getMediaId() + " not found"));
                    return new PublishJob(adapter, post, media, account, progressListener, null);
                })
                .subscribeOn(persistenceScheduler)
                .map(job -> {
                    ComposedContent content = contentAdapterService.compose(post);
                    adapter.validate(job.getMedia(), content);
                    return job.withContent(content);
                });
    }

    private Mono<PlatformPostRef> execute(PublishJob job) {
        return vault.validCredential(job.getAccount())
                .flatMap(credential -> runPhases(job, credential)
                        .onErrorResume(AuthException.class, rejected -> retryWithFreshToken(job, credential, rejected)));
    }

    private Mono<PlatformPostRef> retryWithFreshToken(PublishJob job, AccessCredential used, AuthException rejected) {
        SocialAccount account = job.getAccount();
        log.warn("{} rejected the token of account {} ({}), refreshing and retrying once",
                account.getPlatform().getDisplayName(), account.getId(), rejected.getMessage());

        return vault.forceRefresh(account, used.getAccessToken())
                .flatMap(vault::validCredential)
                .flatMap(credential -> runPhases(job, credential)
                        .onErrorResume(AuthException.class, again -> vault
                                .deactivate(account, "token rejected after refresh: " + again.getMessage())
                                .then(Mono.error(again))));
    }

    private Mono<PlatformPostRef> runPhases(PublishJob job, AccessCredential credential) {
        PublishAdapter adapter = job.getAdapter();
        PublishContext context = PublishContext.builder()
                .post(job.getPost())
                .media(job.getMedia())
                .content(job.getContent())
                .credential(credential)
                .progressListener(job.getProgressListener())
                .build();

        return Mono.defer(() -> adapter.initiate(context))
                .flatMap(handle -> adapter.transfer(context, handle))
                .flatMap(handle -> adapter.awaitReady(context, handle))
                .flatMap(handle -> {
                    if (handle.getPhase() != JobPhase.READY) {
                        return Mono.error(new ProcessingFailureException(adapter.getPlatform().getDisplayName()
                                + " job " + handle.getJobId() + " ended in phase " + handle.getPhase()));
                    }
                    return adapter.finalizePost(context, handle);
                });
    }

    private Mono<PublishOutcome> markPublished(SocialPost post, PlatformPostRef ref) {
        return Mono.fromCallable(() -> {
                    post.setStatus(PostStatus.PUBLISHED);
                    post.setPlatformPostId(ref.getPostId());
                    post.setPlatformUrl(ref.getUrl());
                    post.setPublishedAt(OffsetDateTime.now(clock));
                    post.setErrorMessage(null);
                    SocialPost saved = postRepository.save(post);
                    log.info("Published post {} to {}: {}", post.getId(), post.getPlatform().getDisplayName(),
                            ref.getUrl());
                    return PublishOutcome.published(saved);
                })
                .subscribeOn(persistenceScheduler);
    }

    private Mono<PublishOutcome> markFailed(SocialPost post, Throwable error) {
        PublishOutcome outcome = PublishOutcome.failure(post, error);
        log.error("Failed to publish post {} to {} [{}]: {}", post.getId(), post.getPlatform().getDisplayName(),
                outcome.getErrorCode(), outcome.getError());

        return Mono.fromCallable(() -> {
                    post.setStatus(PostStatus.FAILED);
                    post.setErrorMessage(outcome.getError());
                    postRepository.save(post);
                    return outcome;
                })
                .subscribeOn(persistenceScheduler)
                .onErrorResume(persistError -> {
                    log.error("Could not record the failure of post {}: {}", post.getId(),
                            persistError.getMessage(), persistError);
                    return Mono.just(outcome);
                });
    }

    /**
     * Moves a claimed post from {@code PUBLISHING} to {@code FAILED}. A no-op when the post already
     * reached another status.
     */
    private void releaseCancelled(SocialPost post) {
        Mono.fromCallable(() -> postRepository.transitionStatus(post.getId(), EnumSet.of(PostStatus.PUBLISHING),
                        PostStatus.FAILED, CANCELLED_MESSAGE))
                .subscribeOn(persistenceScheduler)
                .subscribe(updated -> {
                            if (updated == 1) {
                                post.setStatus(PostStatus.FAILED);
                                post.setErrorMessage(CANCELLED_MESSAGE);
                                log.info("Post {} marked failed after cancellation", post.getId());
                            }
                        },
                        error -> log.error("Could not record the cancellation of post {}: {}", post.getId(),
                                error.getMessage(), error));
    }

    /**
     * Whether a publish holds its claim and whether its subscriber went away. Whichever of the two
     * happens second releases the claim.
     */
    private static final class PublishAttempt {
        private boolean claimed;
        private boolean cancelled;

        synchronized boolean claim() {
            claimed = true;
            return cancelled;
        }

        synchronized boolean cancel() {
            cancelled = true;
            return claimed;
        }
    }

    @Value
    private static class PublishJob {
        PublishAdapter adapter;
        SocialPost post;
        MediaAsset media;
        SocialAccount account;
        UploadProgressListener progressListener;
        @With
        ComposedContent content;
    }
}
