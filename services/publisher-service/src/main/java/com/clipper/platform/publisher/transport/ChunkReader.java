package com.clipper.platform.publisher.transport;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads ascending byte ranges off one open stream, holding at most one chunk in memory.
 */
final class ChunkReader implements Closeable {

    private final InputStream in;
    private long position;

    ChunkReader(InputStream in) {
        this.in = in;
    }

    byte[] read(ByteRange range) throws IOException {
        if (range.getStart() < position) {
            throw new IOException("Range " + range + " starts before stream position " + position);
        }
        if (range.getStart() > position) {
            in.skipNBytes(range.getStart() - position);
            position = range.getStart();
        }
        long length = range.length();
        if (length > Integer.MAX_VALUE - 8) {
            throw new IOException("Chunk of " + length + " bytes is too large to buffer");
        }
        byte[] bytes = in.readNBytes((int) length);
        if (bytes.length != length) {
            throw new EOFException("Media ended at byte " + (position + bytes.length)
                    + ", expected " + (range.getEnd() + 1));
        }
        position += length;
        return bytes;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
