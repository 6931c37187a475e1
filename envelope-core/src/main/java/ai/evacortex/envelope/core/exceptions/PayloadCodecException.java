/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.exceptions;

public class PayloadCodecException extends RuntimeException {
    public PayloadCodecException(String message) {
        super("Payload codec failure: " + message);
    }

    public PayloadCodecException(String message, Throwable cause) {
        super("Payload codec failure: " + message, cause);
    }
}
