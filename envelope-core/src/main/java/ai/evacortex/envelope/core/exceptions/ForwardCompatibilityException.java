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
 * Raised when a header was written by software newer than the running one.
 * Such headers are never interpreted, even when their size fields look sane.
 */
public class ForwardCompatibilityException extends RuntimeException {

    private final String headerVersion;
    private final String currentVersion;

    public ForwardCompatibilityException(String headerVersion, String currentVersion) {
        super("Envelope version " + headerVersion + " is newer than supported version " + currentVersion);
        this.headerVersion = headerVersion;
        this.currentVersion = currentVersion;
    }

    public String headerVersion()  { return headerVersion; }
    public String currentVersion() { return currentVersion; }
}
