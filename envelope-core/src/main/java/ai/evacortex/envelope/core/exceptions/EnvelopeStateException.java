/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.exceptions;

/**
 * Internal bookkeeping went wrong. Indicates a bug in this library, not bad input.
 */
public class EnvelopeStateException extends IllegalStateException {
    public EnvelopeStateException(String message) {
        super(message);
    }

    public EnvelopeStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
