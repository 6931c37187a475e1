/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Sequential view over a window of a {@link FileChannel}, starting at {@code offset}
 * and ending after at most {@code limit} bytes or at end of file.
 *
 * <p>
 * Reads are positional, so the channel's own position is never moved and several
 * sections may share one channel. A single section is not thread-safe.
 * </p>
 */
public final class SectionInputStream extends InputStream {

    private final FileChannel channel;
    private final long offset;
    private final long limit;
    private long position;

    public SectionInputStream(FileChannel channel, long offset, long limit) {
        if (offset < 0) throw new IllegalArgumentException("Negative offset: " + offset);
        if (limit < 0) throw new IllegalArgumentException("Negative limit: " + limit);
        this.channel = channel;
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n <= 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) return 0;
        long left = limit - position;
        if (left <= 0) return -1;
        int want = (int) Math.min(len, left);
        int n = channel.read(ByteBuffer.wrap(b, off, want), offset + position);
        if (n > 0) position += n;
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        if (n <= 0) return 0;
        long end = Math.min(limit, Math.max(position, channel.size() - offset));
        long skipped = Math.min(n, end - position);
        position += skipped;
        return skipped;
    }

    @Override
    public int available() throws IOException {
        long left = Math.min(limit, channel.size() - offset) - position;
        return (int) Math.max(0, Math.min(left, Integer.MAX_VALUE));
    }

    /** Bytes consumed since {@code offset}. */
    public long position() { return position; }

    public long offset()   { return offset; }
    public long limit()    { return limit; }
}
