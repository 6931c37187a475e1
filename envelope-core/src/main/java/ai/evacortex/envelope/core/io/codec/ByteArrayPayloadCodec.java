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

/** Identity codec for callers that serialize payloads themselves. */
public final class ByteArrayPayloadCodec implements PayloadCodec<byte[]> {

    public static final ByteArrayPayloadCodec INSTANCE = new ByteArrayPayloadCodec();

    private ByteArrayPayloadCodec() {}

    @Override
    public byte[] encode(byte[] payload) {
        if (payload == null) throw new PayloadCodecException("null payload");
        return payload.clone();
    }

    @Override
    public byte[] decode(byte[] data) {
        return data;
    }

    @Override
    public int estimateSize(byte[] payload) {
        if (payload == null) throw new PayloadCodecException("null payload");
        return payload.length;
    }
}
