/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io.format;

import ai.evacortex.envelope.core.config.EnvelopeFormat;
import ai.evacortex.envelope.core.exceptions.ForwardCompatibilityException;
import ai.evacortex.envelope.core.exceptions.MalformedHeaderException;
import ai.evacortex.envelope.core.exceptions.TruncatedEnvelopeException;
import ai.evacortex.envelope.core.io.Buffers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * HeaderCodec writes and reads {@link EnvelopeHeader}s for one {@link EnvelopeFormat}.
 *
 * <h3>Encoding</h3>
 * The write path has no variable-length logic: the version field, the header size
 * and the data size are laid out back to back, little-endian, exactly
 * {@link EnvelopeFormat#headerSize()} bytes. A writer only ever emits the fields it knows.
 *
 * <h3>Decoding</h3>
 * The read path trusts the header size written into the stream rather than its own
 * width. Whatever follows the data size field up to that header size belongs to
 * fields appended by later versions; those bytes are consumed and dropped.
 *
 * <h3>Compatibility</h3>
 * Independently of the size skip, a header whose version sorts after the current
 * version is refused with {@link ForwardCompatibilityException}. The two guards are
 * intentionally layered: the skip keeps the byte layout extensible, the version gate
 * keeps this generation from interpreting data it was never built for. Relaxing the
 * gate is what would let the skip pay off; it is not relaxed here.
 *
 * <h3>Errors</h3>
 * <ul>
 *   <li>{@link EOFException} when the stream ends before the first header byte</li>
 *   <li>{@link TruncatedEnvelopeException} when it ends inside the header</li>
 *   <li>{@link MalformedHeaderException} when the header size cannot hold the known fields</li>
 * </ul>
 */
public final class HeaderCodec {

    private static final Logger log = LoggerFactory.getLogger(HeaderCodec.class);

    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final int SIZE_FIELD_LENGTH = Long.BYTES;

    private final EnvelopeFormat format;

    public HeaderCodec(EnvelopeFormat format) {
        this.format = format;
    }

    /** Known header width of this generation. */
    public int headerSize() {
        return format.headerSize();
    }

    public EnvelopeHeader newHeader(long dataSize) {
        if (dataSize < 0)
            throw new IllegalArgumentException("Negative data size: " + dataSize);
        return new EnvelopeHeader(format.version(), format.headerSize(), dataSize);
    }

    /**
     * Writes the fields of this generation. The header must describe this generation's
     * width; layouts of other generations are never produced here.
     */
    public byte[] encode(EnvelopeHeader header) {
        if (header.headerSize() != format.headerSize())
            throw new IllegalArgumentException("Header size " + header.headerSize()
                    + " does not match format width " + format.headerSize());
        if (header.dataSize() < 0)
            throw new IllegalArgumentException("Negative data size: " + header.dataSize());
        byte[] versionField = VersionTag.encode(header.version(), format.maxVersionLength());
        ByteBuffer buf = ByteBuffer.allocate(format.headerSize()).order(ORDER);
        buf.put(versionField);
        buf.putLong(header.headerSize());
        buf.putLong(header.dataSize());
        return buf.array();
    }

    public EnvelopeHeader decode(InputStream in) throws IOException {
        int maxLen = format.maxVersionLength();

        byte[] versionField = new byte[maxLen];
        int n = Buffers.readFully(in, versionField);
        if (n == 0) throw new EOFException("No envelope: end of stream");
        if (n < maxLen) throw new TruncatedEnvelopeException("header version field", maxLen, n);
        String version = VersionTag.decode(versionField);

        long headerSize = readSizeField(in, "header size field");

        // newer generations are refused whatever their size fields claim
        if (VersionTag.isNewerThan(version, format.version())) {
            throw new ForwardCompatibilityException(version, format.version());
        }

        int remaining = remainingHeaderBytes(version, headerSize);
        byte[] dataSizeField = new byte[SIZE_FIELD_LENGTH];
        n = Buffers.readFully(in, dataSizeField);
        if (n < SIZE_FIELD_LENGTH) throw new TruncatedEnvelopeException("header fields", remaining, n);
        long dataSize = ByteBuffer.wrap(dataSizeField).order(ORDER).getLong();

        // unknown trailing fields are drained in chunks, never buffered whole
        long unknown = remaining - SIZE_FIELD_LENGTH;
        if (unknown > 0) {
            long dropped = Buffers.discard(in, unknown);
            if (dropped < unknown)
                throw new TruncatedEnvelopeException("header fields", remaining, SIZE_FIELD_LENGTH + dropped);
            log.debug("Skipped {} bytes of unknown header fields (version {}, headerSize {})",
                    unknown, version, headerSize);
        }
        return new EnvelopeHeader(version, headerSize, dataSize);
    }

    private long readSizeField(InputStream in, String what) throws IOException {
        byte[] field = new byte[SIZE_FIELD_LENGTH];
        int n = Buffers.readFully(in, field);
        if (n < SIZE_FIELD_LENGTH) throw new TruncatedEnvelopeException(what, SIZE_FIELD_LENGTH, n);
        return ByteBuffer.wrap(field).order(ORDER).getLong();
    }

    /** Bytes left after the header size field; always covers at least the data size field. */
    private int remainingHeaderBytes(String version, long headerSize) throws MalformedHeaderException {
        long minimum = format.headerSize();
        long maximum = Math.min(format.maxMarshalledSize(), Integer.MAX_VALUE - 8L);
        // u64 on the wire: anything with the top bit set reads as negative
        if (headerSize < minimum || headerSize > maximum) {
            throw new MalformedHeaderException("Header size " + Long.toUnsignedString(headerSize)
                    + " outside [" + minimum + ", " + maximum + "] (version " + version + ")");
        }
        return (int) (headerSize - format.maxVersionLength() - SIZE_FIELD_LENGTH);
    }
}
