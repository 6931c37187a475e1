/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.exceptions;

public class VersionOverflowException extends RuntimeException {
    public VersionOverflowException(String version, int maxLength) {
        super("Version string '" + version + "' (" + version.length()
                + " bytes) does not fit a " + maxLength + "-byte version field");
    }
}
