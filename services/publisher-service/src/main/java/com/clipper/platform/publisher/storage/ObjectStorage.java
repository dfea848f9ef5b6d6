package com.clipper.platform.publisher.storage;

import java.io.InputStream;
import java.time.Duration;

public interface ObjectStorage {

    /**
     * Time-limited GET URL for {@code key}, reachable from outside the storage network.
     */
    String presignedUrl(String key, Duration ttl);

    InputStream openStream(String key);

    long size(String key);
}
