package com.clipper.platform.publisher.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One transferable piece of media: either the asset itself or a carousel child.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MediaItem {

    @JsonProperty("storage_key")
    private String storageKey;

    @JsonProperty("source_url")
    private String sourceUrl;

    @JsonProperty("content_type")
    private String contentType;

    @JsonProperty("size_bytes")
    private Long sizeBytes;

    @JsonProperty("duration_seconds")
    private Double durationSeconds;

    private Integer width;

    private Integer height;

    @JsonIgnore
    public boolean isVideo() {
        return contentType != null && contentType.startsWith("video/");
    }
}
