package com.clipper.platform.publisher.storage;

import com.clipper.platform.publisher.config.StorageProperties;
import com.clipper.platform.publisher.entity.MediaItem;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.transport.MediaSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.InputStream;

/**
 * Resolves media items to what a platform needs: a public URL to pull from, or a byte stream to
 * upload directly.
 */
@Service
@RequiredArgsConstructor
public class MediaLocator {

    private final ObjectStorage objectStorage;
    private final StorageProperties properties;

    public String publicUrl(MediaItem item) {
        if (item.getStorageKey() != null) {
            return objectStorage.presignedUrl(item.getStorageKey(), properties.getPresignTtl());
        }
        if (item.getSourceUrl() != null) {
            return item.getSourceUrl();
        }
        throw new ValidationException("Media has neither a storage key nor a source URL");
    }

    public boolean isStored(MediaItem item) {
        return item.getStorageKey() != null;
    }

    public MediaSource source(MediaItem item) {
        String key = item.getStorageKey();
        if (key == null) {
            throw new ValidationException("Direct upload requires the media to be in object storage");
        }
        long size = item.getSizeBytes() != null ? item.getSizeBytes() : objectStorage.size(key);
        return new MediaSource() {
            @Override
            public long size() {
                return size;
            }

            @Override
            public InputStream openStream() {
                return objectStorage.openStream(key);
            }
        };
    }
}
