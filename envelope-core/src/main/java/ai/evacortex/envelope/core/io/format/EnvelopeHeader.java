/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io.format;

import java.util.Objects;

/**
 * Header preceding every envelope payload.
 *
 * <h3>Layout</h3>
 * Little-endian, append-only across versions:
 * <pre>
 * [VERSION     (MAXLEN bytes)]   // ASCII, zero padded
 * [HEADER_SIZE (8 bytes)]        // whole header, including fields appended by later versions
 * [DATA_SIZE   (8 bytes)]        // payload length
 * [...]                          // future fields, skipped by older readers
 * </pre>
 * Existing fields never change type, width or position.
 *
 * @see HeaderCodec
 */
public final class EnvelopeHeader {

    private final String version;
    private final long headerSize;
    private final long dataSize;

    public EnvelopeHeader(String version, long headerSize, long dataSize) {
        this.version = Objects.requireNonNull(version, "version");
        this.headerSize = headerSize;
        this.dataSize = dataSize;
    }

    public String version()  { return version; }
    public long headerSize() { return headerSize; }
    public long dataSize()   { return dataSize; }

    /** Total bytes occupied by this envelope, header included. */
    public long envelopeSize() {
        return headerSize + dataSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnvelopeHeader)) return false;
        EnvelopeHeader that = (EnvelopeHeader) o;
        return headerSize == that.headerSize && dataSize == that.dataSize && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, headerSize, dataSize);
    }

    @Override
    public String toString() {
        return "EnvelopeHeader{version=" + version + ", headerSize=" + headerSize + ", dataSize=" + dataSize + '}';
    }
}
