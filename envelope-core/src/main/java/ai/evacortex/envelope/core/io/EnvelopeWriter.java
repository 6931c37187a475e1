/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io;

import ai.evacortex.envelope.core.config.EnvelopeFormat;
import ai.evacortex.envelope.core.exceptions.PayloadCodecException;
import ai.evacortex.envelope.core.io.codec.PayloadCodec;
import ai.evacortex.envelope.core.io.format.EnvelopeHeader;
import ai.evacortex.envelope.core.io.format.HeaderCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * EnvelopeWriter serializes a payload and writes it, prefixed by an
 * {@link EnvelopeHeader}, to a sequential or positional sink.
 *
 * <p>
 * The payload is encoded first and the header is assembled fully in memory before
 * the first byte reaches the sink: a codec failure writes nothing.
 * </p>
 *
 * <h3>Partial writes</h3>
 * Header and payload are two separate writes. If the payload write fails after the
 * header went out, the sink holds a truncated envelope whose header announces more
 * bytes than follow it. The failure is propagated and never retried here; readers
 * detect the truncation as {@link ai.evacortex.envelope.core.exceptions.TruncatedEnvelopeException}.
 *
 * <h3>Concurrency</h3>
 * The writer itself is stateless and may be shared. A sink may not: one write per
 * stream or channel region at a time.
 *
 * @see EnvelopeReader
 * @see HeaderCodec
 */
public final class EnvelopeWriter<T> {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeWriter.class);

    private final EnvelopeFormat format;
    private final HeaderCodec headerCodec;
    private final PayloadCodec<T> codec;

    public EnvelopeWriter(EnvelopeFormat format, PayloadCodec<T> codec) {
        this.format = format;
        this.headerCodec = new HeaderCodec(format);
        this.codec = codec;
    }

    /** @return bytes written, header included */
    public long write(OutputStream out, T payload) throws IOException {
        byte[] data = encodePayload(payload);
        byte[] header = headerCodec.encode(headerCodec.newHeader(data.length));

        out.write(header);
        try {
            out.write(data);
        } catch (IOException e) {
            log.warn("Payload write failed after {}-byte header; sink now holds a truncated envelope",
                    header.length);
            throw e;
        }

        log.debug("Wrote envelope: version={}, header={}B, payload={}B", format.version(), header.length, data.length);
        return (long) header.length + data.length;
    }

    /**
     * Positional variant of {@link #write(OutputStream, Object)}. The channel's own
     * position is left untouched.
     *
     * @return bytes written starting at {@code offset}
     */
    public long writeAt(FileChannel channel, long offset, T payload) throws IOException {
        if (offset < 0) throw new IllegalArgumentException("Negative offset: " + offset);
        byte[] data = encodePayload(payload);
        byte[] header = headerCodec.encode(headerCodec.newHeader(data.length));

        long position = offset;
        position += Buffers.writeFully(channel, ByteBuffer.wrap(header), position);
        try {
            position += Buffers.writeFully(channel, ByteBuffer.wrap(data), position);
        } catch (IOException e) {
            log.warn("Payload write at offset {} failed after {}-byte header; channel now holds a truncated envelope",
                    offset, header.length);
            throw e;
        }

        log.debug("Wrote envelope at offset {}: header={}B, payload={}B", offset, header.length, data.length);
        return position - offset;
    }

    private byte[] encodePayload(T payload) {
        byte[] data = codec.encode(payload);
        if (data == null) throw new PayloadCodecException("codec returned no bytes");
        long total = (long) headerCodec.headerSize() + data.length;
        if (total > format.maxMarshalledSize()) {
            throw new PayloadCodecException("envelope of " + total + " bytes exceeds maxMarshalledSize "
                    + format.maxMarshalledSize());
        }
        return data;
    }
}
