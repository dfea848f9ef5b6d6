package com.clipper.platform.publisher.connector;

import lombok.Value;

import java.util.Objects;

/**
 * Identity of a published post on the remote platform. Both parts are always present.
 */
@Value
public class PlatformPostRef {
    String postId;
    String url;

    public PlatformPostRef(String postId, String url) {
        this.postId = Objects.requireNonNull(postId, "postId");
        this.url = Objects.requireNonNull(url, "url");
    }
}
