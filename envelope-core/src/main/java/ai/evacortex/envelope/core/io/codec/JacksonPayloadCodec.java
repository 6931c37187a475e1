/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io.codec;

import ai.evacortex.envelope.core.exceptions.PayloadCodecException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;

/**
 * JSON payloads through a Jackson {@link ObjectMapper}.
 *
 * <p>
 * {@link #estimateSize(Object)} streams the JSON into a byte counter, so no encoded
 * copy is kept. The count matches {@link #encode(Object)} as long as the mapper's
 * output for a value is deterministic.
 * </p>
 *
 * @param <T> payload type
 */
public class JacksonPayloadCodec<T> implements PayloadCodec<T> {

    private final ObjectMapper mapper;
    private final JavaType type;

    public JacksonPayloadCodec(Class<T> type) {
        this(new ObjectMapper(), type);
    }

    public JacksonPayloadCodec(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = mapper.getTypeFactory().constructType(type);
    }

    public JacksonPayloadCodec(ObjectMapper mapper, TypeReference<T> typeRef) {
        this.mapper = mapper;
        this.type = mapper.getTypeFactory().constructType(typeRef);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writerFor(type).writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new PayloadCodecException("cannot serialize " + type, e);
        }
    }

    @Override
    public T decode(byte[] data) {
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new PayloadCodecException("cannot deserialize " + type, e);
        }
    }

    @Override
    public int estimateSize(T payload) {
        CountingOutputStream counter = new CountingOutputStream();
        try {
            mapper.writerFor(type).writeValue(counter, payload);
        } catch (IOException e) {
            throw new PayloadCodecException("cannot size " + type, e);
        }
        return Math.toIntExact(counter.count);
    }

    private static final class CountingOutputStream extends OutputStream {
        private long count;

        @Override
        public void write(int b) {
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) {
            count += len;
        }
    }
}
