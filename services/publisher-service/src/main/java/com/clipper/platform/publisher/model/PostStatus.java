package com.clipper.platform.publisher.model;

import java.util.EnumSet;
import java.util.Set;

public enum PostStatus {
    DRAFT,
    SCHEDULED,
    PUBLISHING,
    PUBLISHED,
    FAILED;

    /**
     * Statuses a publish attempt may start from. PUBLISHED is terminal and PUBLISHING is owned by
     * the attempt already in flight.
     */
    public static final Set<PostStatus> PUBLISHABLE = EnumSet.of(DRAFT, SCHEDULED, FAILED);

    public boolean isPublishable() {
        return PUBLISHABLE.contains(this);
    }
}
