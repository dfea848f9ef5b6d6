package com.clipper.platform.publisher.transport;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bytes of a media payload, read as a stream so large files are never held in memory whole.
 */
public interface MediaSource {

    long size();

    InputStream openStream() throws IOException;
}
