/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io;

/**
 * Payload read from a positional source, with the bytes its envelope occupied.
 *
 * @param payload       decoded payload
 * @param offset        where the envelope starts
 * @param bytesConsumed header plus payload bytes read from {@code offset}
 */
public record PositionedPayload<T>(T payload, long offset, long bytesConsumed) {

    /** Offset of the envelope stored right after this one. */
    public long nextOffset() {
        return offset + bytesConsumed;
    }
}
