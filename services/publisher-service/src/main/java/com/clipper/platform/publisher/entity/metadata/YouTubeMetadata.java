package com.clipper.platform.publisher.entity.metadata;

import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonIgnoreProperties(ignoreUnknown = true)
public class YouTubeMetadata extends AccountMetadata {

    @JsonProperty("channel_id")
    private String channelId;

    @JsonProperty("channel_title")
    private String channelTitle;

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE;
    }
}
