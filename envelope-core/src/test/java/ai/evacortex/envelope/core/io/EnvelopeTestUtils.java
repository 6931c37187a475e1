/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io;

import ai.evacortex.envelope.core.io.format.VersionTag;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

public final class EnvelopeTestUtils {

    private EnvelopeTestUtils() {}

    /**
     * Header as a later generation would write it: the known fields (16-byte version
     * field), then {@code extra} bytes of fields this generation has never heard of.
     */
    public static byte[] futureHeader(String version, long dataSize, byte[] extra) {
        int headerSize = 32 + extra.length;
        ByteBuffer buf = ByteBuffer.allocate(headerSize).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(VersionTag.encode(version, 16));
        buf.putLong(headerSize);
        buf.putLong(dataSize);
        buf.put(extra);
        return buf.array();
    }

    /** Known fields only, with whatever sizes the caller claims, valid or not. */
    public static byte[] rawHeader(String version, long headerSize, long dataSize) {
        ByteBuffer buf = ByteBuffer.allocate(32).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(VersionTag.encode(version, 16));
        buf.putLong(headerSize);
        buf.putLong(dataSize);
        return buf.array();
    }

    public static byte[] concat(byte[]... parts) {
        byte[] out = new byte[0];
        for (byte[] part : parts) {
            int at = out.length;
            out = Arrays.copyOf(out, at + part.length);
            System.arraycopy(part, 0, out, at, part.length);
        }
        return out;
    }

    /** Accepts {@code allowedWrites} write calls, then fails every following one. */
    public static final class FailingOutputStream extends OutputStream {
        private final int allowedWrites;
        private int writes;
        private long written;

        public FailingOutputStream(int allowedWrites) {
            this.allowedWrites = allowedWrites;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (writes++ >= allowedWrites) throw new IOException("disk full");
            written += len;
        }

        public long written() { return written; }
        public int writes()   { return writes; }
    }
}
