package com.clipper.platform.publisher.model;

import lombok.Getter;

import java.time.Duration;

@Getter
public enum Platform {
    INSTAGRAM(
        "Instagram",
        2200,       // caption length
        0,          // no separate title
        30,         // max hashtags
        true,       // hashtags in caption
        Duration.ofDays(7)      // long-lived token exchange is rate limited
    ),
    YOUTUBE(
        "YouTube",
        5000,       // description length
        100,        // title length
        500,        // tags total chars (not count)
        false,      // hashtags become tags
        Duration.ofMinutes(5)
    ),
    TIKTOK(
        "TikTok",
        2200,       // caption length
        0,          // caption doubles as title
        30,         // max hashtags (soft limit)
        true,       // hashtags in caption
        Duration.ofMinutes(5)
    ),
    LINKEDIN(
        "LinkedIn",
        3000,       // commentary length
        200,        // media title length
        30,         // max hashtags
        true,       // hashtags in commentary
        Duration.ofMinutes(5)
    );

    private final String displayName;
    private final int maxCaptionLength;
    private final int maxTitleLength;
    private final int maxHashtags;
    private final boolean hashtagsInCaption;
    private final Duration refreshBuffer;

    Platform(String displayName, int maxCaptionLength, int maxTitleLength, int maxHashtags,
             boolean hashtagsInCaption, Duration refreshBuffer) {
        this.displayName = displayName;
        this.maxCaptionLength = maxCaptionLength;
        this.maxTitleLength = maxTitleLength;
        this.maxHashtags = maxHashtags;
        this.hashtagsInCaption = hashtagsInCaption;
        this.refreshBuffer = refreshBuffer;
    }
}
