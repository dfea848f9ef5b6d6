package com.clipper.platform.publisher.model;

/**
 * Audience requested for a post. Each adapter maps it onto the platform's own privacy vocabulary.
 */
public enum Visibility {
    PUBLIC,
    UNLISTED,
    FOLLOWERS,
    PRIVATE
}
