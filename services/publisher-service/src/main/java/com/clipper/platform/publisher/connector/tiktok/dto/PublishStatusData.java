package com.clipper.platform.publisher.connector.tiktok.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PublishStatusData {
    private String status;
    @JsonProperty("fail_reason")
    private String failReason;
    @JsonProperty("uploaded_bytes")
    private Long uploadedBytes;
    @JsonProperty("downloaded_bytes")
    private Long downloadedBytes;
    // Spelling is TikTok's
    @JsonProperty("publicaly_available_post_id")
    private List<String> publicPostIds;

    public String firstPublicPostId() {
        return publicPostIds == null || publicPostIds.isEmpty() ? null : publicPostIds.get(0);
    }
}
