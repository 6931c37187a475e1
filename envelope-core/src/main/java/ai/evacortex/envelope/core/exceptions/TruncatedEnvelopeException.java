/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.exceptions;

import java.io.EOFException;

/**
 * The stream ended part way through an envelope. A stream that ends before the
 * first header byte is a plain {@link EOFException} instead.
 */
public class TruncatedEnvelopeException extends EOFException {

    private final long expected;
    private final long actual;

    public TruncatedEnvelopeException(String what, long expected, long actual) {
        super("Truncated envelope: expected " + expected + " bytes of " + what + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() { return expected; }
    public long actual()   { return actual; }
}
