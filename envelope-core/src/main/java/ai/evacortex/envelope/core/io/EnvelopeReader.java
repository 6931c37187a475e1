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
import ai.evacortex.envelope.core.exceptions.EnvelopeStateException;
import ai.evacortex.envelope.core.exceptions.MalformedHeaderException;
import ai.evacortex.envelope.core.exceptions.TruncatedEnvelopeException;
import ai.evacortex.envelope.core.io.codec.PayloadCodec;
import ai.evacortex.envelope.core.io.format.EnvelopeHeader;
import ai.evacortex.envelope.core.io.format.HeaderCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.List;

/**
 * EnvelopeReader decodes envelopes produced by {@link EnvelopeWriter}.
 *
 * <p>
 * The header is decoded first; exactly {@code dataSize} payload bytes are then read
 * and handed to the {@link PayloadCodec}. A stream that is empty before the header
 * raises a plain {@link EOFException} (no more envelopes); a stream that ends anywhere
 * inside an envelope raises {@link TruncatedEnvelopeException}. Partial data is never
 * returned.
 * </p>
 *
 * <h3>Positional reads</h3>
 * {@link #readAt(FileChannel, long)} reads through a {@link SectionInputStream} bounded
 * to {@link EnvelopeFormat#maxMarshalledSize()} bytes and reports how many bytes the
 * envelope occupied, so envelopes stored back to back can be walked with
 * {@link PositionedPayload#nextOffset()}.
 *
 * <h3>Limits</h3>
 * An envelope larger than {@code maxMarshalledSize} is refused with
 * {@link MalformedHeaderException} before its payload buffer is allocated.
 *
 * @see EnvelopeWriter
 * @see HeaderCodec
 */
public final class EnvelopeReader<T> {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeReader.class);

    private final EnvelopeFormat format;
    private final HeaderCodec headerCodec;
    private final PayloadCodec<T> codec;

    public EnvelopeReader(EnvelopeFormat format, PayloadCodec<T> codec) {
        this.format = format;
        this.headerCodec = new HeaderCodec(format);
        this.codec = codec;
    }

    public T read(InputStream in) throws IOException {
        EnvelopeHeader header = headerCodec.decode(in);
        int dataSize = checkedDataSize(header);

        byte[] data = Buffers.readUpTo(in, dataSize);
        if (data.length < dataSize) throw new TruncatedEnvelopeException("payload", dataSize, data.length);

        log.debug("Read envelope: version={}, header={}B, payload={}B, total={}B",
                header.version(), header.headerSize(), dataSize, header.envelopeSize());
        return codec.decode(data);
    }

    public PositionedPayload<T> readAt(FileChannel channel, long offset) throws IOException {
        SectionInputStream section = new SectionInputStream(channel, offset, format.maxMarshalledSize());
        T payload = read(section);

        long consumed = section.position();
        if (consumed <= 0 || consumed > section.limit()) {
            throw new EnvelopeStateException("Section position " + consumed + " outside (0, "
                    + section.limit() + "] after reading envelope at offset " + section.offset());
        }
        return new PositionedPayload<>(payload, offset, consumed);
    }

    /** Reads concatenated envelopes until the stream ends cleanly between two envelopes. */
    public List<T> readAll(InputStream in) throws IOException {
        List<T> payloads = new ArrayList<>();
        while (true) {
            try {
                payloads.add(read(in));
            } catch (TruncatedEnvelopeException e) {
                throw e;
            } catch (EOFException e) {
                return payloads;
            }
        }
    }

    /** Walks envelopes stored back to back from {@code offset} up to the end of the channel. */
    public List<PositionedPayload<T>> readAllAt(FileChannel channel, long offset) throws IOException {
        List<PositionedPayload<T>> payloads = new ArrayList<>();
        long position = offset;
        long end = channel.size();
        while (position < end) {
            PositionedPayload<T> next = readAt(channel, position);
            payloads.add(next);
            position = next.nextOffset();
        }
        return payloads;
    }

    private int checkedDataSize(EnvelopeHeader header) throws MalformedHeaderException {
        long dataSize = header.dataSize();
        long maxData = Math.min(format.maxMarshalledSize() - header.headerSize(), Integer.MAX_VALUE - 8L);
        if (dataSize < 0 || dataSize > maxData) {
            throw new MalformedHeaderException("Data size " + Long.toUnsignedString(dataSize)
                    + " exceeds limit " + maxData + " (version " + header.version() + ")");
        }
        return (int) dataSize;
    }
}
