package com.clipper.platform.publisher.dto;

import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Result of one publish call. Every call ends with one of these, never with an exception.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PublishOutcome {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private boolean success;
    private UUID postId;
    private Platform platform;
    private String platformPostId;
    private String platformUrl;
    private String error;
    private String errorCode;
    private boolean retryable;
    private OffsetDateTime publishedAt;

    public static PublishOutcome published(SocialPost post) {
        return PublishOutcome.builder()
                .success(true)
                .postId(post.getId())
                .platform(post.getPlatform())
                .platformPostId(post.getPlatformPostId())
                .platformUrl(post.getPlatformUrl())
                .publishedAt(post.getPublishedAt())
                .build();
    }

    public static PublishOutcome failure(UUID postId, Platform platform, Throwable error) {
        PublishOutcomeBuilder outcome = PublishOutcome.builder()
                .success(false)
                .postId(postId)
                .platform(platform)
                .error(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        if (error instanceof PublishException) {
            PublishException publishError = (PublishException) error;
            outcome.errorCode(publishError.getType().getCode())
                    .retryable(publishError.isRetryable());
        } else {
            outcome.errorCode(INTERNAL_ERROR);
        }
        return outcome.build();
    }

    public static PublishOutcome failure(SocialPost post, Throwable error) {
        return failure(post.getId(), post.getPlatform(), error);
    }
}
