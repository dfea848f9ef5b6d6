package com.clipper.platform.publisher.polling;

public enum JobPhase {
    INITIATED,
    UPLOADING,
    PROCESSING,
    READY,
    ERROR
}
