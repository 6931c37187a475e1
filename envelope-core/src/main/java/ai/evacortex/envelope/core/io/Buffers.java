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
import java.util.Arrays;

/**  Utility: full reads and writes over streams and positional channels.  */
public final class Buffers {

    /** Largest buffer allocated before the stream has proven it holds that many bytes. */
    static final int CHUNK_SIZE = 64 * 1024;

    private Buffers() {}

    /**
     * Reads until {@code buf} is full or the stream ends.
     *
     * @return number of bytes actually read; less than {@code buf.length} only at end of stream
     */
    public static int readFully(InputStream in, byte[] buf) throws IOException {
        int filled = 0;
        while (filled < buf.length) {
            int n = in.read(buf, filled, buf.length - filled);
            if (n < 0) break;
            filled += n;
        }
        return filled;
    }

    /**
     * Reads up to {@code size} bytes, growing the buffer only as data arrives, so a
     * short stream never costs an allocation of the full claimed size.
     *
     * @return the bytes read; shorter than {@code size} only at end of stream
     */
    public static byte[] readUpTo(InputStream in, int size) throws IOException {
        byte[] buf = new byte[Math.min(size, CHUNK_SIZE)];
        int filled = 0;
        while (filled < size) {
            if (filled == buf.length) {
                buf = Arrays.copyOf(buf, (int) Math.min(size, 2L * buf.length));
            }
            int n = in.read(buf, filled, buf.length - filled);
            if (n < 0) break;
            filled += n;
        }
        return filled == buf.length ? buf : Arrays.copyOf(buf, filled);
    }

    /**
     * Reads and drops up to {@code count} bytes through a fixed scratch buffer.
     *
     * @return number of bytes discarded; less than {@code count} only at end of stream
     */
    public static long discard(InputStream in, long count) throws IOException {
        byte[] scratch = new byte[(int) Math.min(count, CHUNK_SIZE)];
        long dropped = 0;
        while (dropped < count) {
            int n = in.read(scratch, 0, (int) Math.min(scratch.length, count - dropped));
            if (n < 0) break;
            dropped += n;
        }
        return dropped;
    }

    /**
     * Positional variant of {@link #readFully(InputStream, byte[])}; the channel's own
     * position is left untouched.
     */
    public static int readFully(FileChannel channel, ByteBuffer dst, long position) throws IOException {
        int filled = 0;
        while (dst.hasRemaining()) {
            int n = channel.read(dst, position + filled);
            if (n < 0) break;
            filled += n;
        }
        return filled;
    }

    /** Writes every remaining byte of {@code src} starting at {@code position}. */
    public static int writeFully(FileChannel channel, ByteBuffer src, long position) throws IOException {
        int written = 0;
        while (src.hasRemaining()) {
            written += channel.write(src, position + written);
        }
        return written;
    }
}
