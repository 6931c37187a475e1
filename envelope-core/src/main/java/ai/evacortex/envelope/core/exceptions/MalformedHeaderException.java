/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.exceptions;

import java.io.IOException;

/**
 * Header bytes were read in full but describe an impossible envelope,
 * e.g. a header size smaller than the fields it must contain.
 */
public class MalformedHeaderException extends IOException {
    public MalformedHeaderException(String message) {
        super(message);
    }
}
