/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io.format;

import ai.evacortex.envelope.core.exceptions.VersionOverflowException;

import java.nio.charset.StandardCharsets;

/**
 * Fixed-width, zero-terminated ASCII version field.
 *
 * <p>
 * The field always keeps at least one trailing zero byte, so a version may use
 * at most {@code maxLength - 1} characters. Decoding stops at the first zero
 * byte, or takes the whole field when none is present.
 * </p>
 */
public final class VersionTag {

    private static final byte DELIMITER = 0;

    private VersionTag() {}

    public static byte[] encode(String version, int maxLength) {
        if (version.length() >= maxLength)
            throw new VersionOverflowException(version, maxLength);
        for (int i = 0; i < version.length(); i++) {
            char c = version.charAt(i);
            if (c == DELIMITER || c > 0x7F)
                throw new IllegalArgumentException("Version must be ASCII without NUL: " + version);
        }
        byte[] raw = version.getBytes(StandardCharsets.US_ASCII);

        byte[] field = new byte[maxLength];
        System.arraycopy(raw, 0, field, 0, raw.length);
        return field;
    }

    public static String decode(byte[] field) {
        int end = 0;
        while (end < field.length && field[end] != DELIMITER) end++;
        return new String(field, 0, end, StandardCharsets.US_ASCII);
    }

    /**
     * Bytewise lexicographic comparison, e.g. {@code "1.10.0"} sorts before {@code "1.9.0"}.
     * Callers rely on this exact ordering for the compatibility gate.
     */
    public static boolean isNewerThan(String candidate, String current) {
        return candidate.compareTo(current) > 0;
    }
}
