package com.clipper.platform.publisher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "storage.minio")
public class StorageProperties {
    private String endpoint;
    private String accessKey;
    private String secretKey;
    private String region = "us-east-1";
    private String bucket = "clipper-media";
    private String publicUrl; // base that remote platforms can reach, e.g. behind a CDN
    private Duration presignTtl = Duration.ofHours(1);
}
