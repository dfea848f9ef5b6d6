package com.clipper.platform.publisher.model;

public enum MediaKind {
    IMAGE,
    VIDEO,
    CAROUSEL,
    STORY
}
