package com.clipper.platform.publisher.transport;

@FunctionalInterface
public interface UploadProgressListener {

    UploadProgressListener NONE = (bytesSent, totalBytes) -> { };

    void onProgress(long bytesSent, long totalBytes);
}
