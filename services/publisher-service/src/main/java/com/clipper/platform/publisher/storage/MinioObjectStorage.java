package com.clipper.platform.publisher.storage;

import com.clipper.platform.publisher.config.StorageProperties;
import com.clipper.platform.publisher.exception.GatewayException;
import io.minio.GetObjectArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.MinioClient;
import io.minio.StatObjectArgs;
import io.minio.http.Method;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Duration;

@Service
@RequiredArgsConstructor
@Slf4j
public class MinioObjectStorage implements ObjectStorage {

    private final MinioClient minioClient;
    private final StorageProperties properties;

    @Override
    public String presignedUrl(String key, Duration ttl) {
        try {
            String internalUrl = minioClient.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                    .method(Method.GET)
                    .bucket(properties.getBucket())
                    .object(key)
                    .expiry((int) ttl.toSeconds())
                    .build());
            return PublicUrlRewriter.rewrite(internalUrl, properties.getPublicUrl());
        } catch (Exception e) {
            log.error("Error presigning object {}: {}", key, e.getMessage());
            throw new GatewayException("Failed to presign media " + key, e);
        }
    }

    @Override
    public InputStream openStream(String key) {
        try {
            return minioClient.getObject(GetObjectArgs.builder()
                    .bucket(properties.getBucket())
                    .object(key)
                    .build());
        } catch (Exception e) {
            log.error("Error opening object {}: {}", key, e.getMessage());
            throw new GatewayException("Failed to read media " + key, e);
        }
    }

    @Override
    public long size(String key) {
        try {
            return minioClient.statObject(StatObjectArgs.builder()
                    .bucket(properties.getBucket())
                    .object(key)
                    .build())
                    .size();
        } catch (Exception e) {
            log.error("Error reading metadata of object {}: {}", key, e.getMessage());
            throw new GatewayException("Failed to stat media " + key, e);
        }
    }
}
