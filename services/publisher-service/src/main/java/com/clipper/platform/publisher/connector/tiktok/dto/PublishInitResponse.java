package com.clipper.platform.publisher.connector.tiktok.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PublishInitResponse extends TikTokResponse<PublishInitData> {
}
