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
import ai.evacortex.envelope.core.io.codec.PayloadCodec;

/**
 * Envelope sizes computed without serializing the payload.
 * {@link #totalSize(Object)} equals what {@link EnvelopeWriter#write} reports for the same payload.
 */
public final class EnvelopeSizeEstimator<T> {

    private final EnvelopeFormat format;
    private final PayloadCodec<T> codec;

    public EnvelopeSizeEstimator(EnvelopeFormat format, PayloadCodec<T> codec) {
        this.format = format;
        this.codec = codec;
    }

    public int headerSize() {
        return format.headerSize();
    }

    public long totalSize(T payload) {
        return headerSize() + (long) codec.estimateSize(payload);
    }
}
