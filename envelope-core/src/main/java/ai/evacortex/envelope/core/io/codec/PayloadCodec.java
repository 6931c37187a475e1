/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io.codec;

/**
 * External serializer for the payload carried inside an envelope.
 *
 * <p>
 * The envelope layer never looks into payload bytes. Implementations own the payload
 * schema and its evolution; they report failures as
 * {@link ai.evacortex.envelope.core.exceptions.PayloadCodecException}.
 * </p>
 *
 * @param <T> payload type
 */
public interface PayloadCodec<T> {

    byte[] encode(T payload);

    T decode(byte[] data);

    /**
     * Serialized size of {@code payload} in bytes. Must equal {@code encode(payload).length}.
     */
    int estimateSize(T payload);
}
