package com.clipper.platform.publisher.connector.tiktok.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PublishInitData {
    @JsonProperty("publish_id")
    private String publishId;
    // Only present for FILE_UPLOAD
    @JsonProperty("upload_url")
    private String uploadUrl;
}
