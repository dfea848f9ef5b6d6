package com.clipper.platform.publisher.connector.tiktok.dto;

import lombok.*;

/**
 * Envelope of every Content Posting API response. {@code error.code} is {@code "ok"} on success,
 * even with HTTP 200.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class TikTokResponse<T> {
    private T data;
    private TikTokError error;
}
