/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.junit.jupiter.api.Assertions.*;

class SectionInputStreamTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsWithinWindowOnly() throws IOException {
        Path file = tempDir.resolve("window.bin");
        Files.write(file, new byte[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9});

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
             SectionInputStream section = new SectionInputStream(channel, 2, 5)) {
            assertEquals(2, section.offset());
            assertEquals(5, section.limit());
            byte[] buf = new byte[8];
            assertEquals(5, Buffers.readFully(section, buf));
            assertEquals(2, buf[0]);
            assertEquals(6, buf[4]);
            assertEquals(5, section.position());
            assertEquals(-1, section.read());
        }
    }

    @Test
    void testStopsAtEndOfFile() throws IOException {
        Path file = tempDir.resolve("short.bin");
        Files.write(file, new byte[] {10, 11, 12});

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
             SectionInputStream section = new SectionInputStream(channel, 1, 1024)) {
            assertEquals(2, section.available());
            assertEquals(11, section.read());
            assertEquals(1, section.skip(100));
            assertEquals(-1, section.read());
            assertEquals(2, section.position());
        }
    }

    @Test
    void testRejectsNegativeBounds() throws IOException {
        Path file = tempDir.resolve("empty.bin");
        Files.write(file, new byte[0]);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            assertThrows(IllegalArgumentException.class, () -> new SectionInputStream(channel, -1, 10));
            assertThrows(IllegalArgumentException.class, () -> new SectionInputStream(channel, 0, -10));
        }
    }
}
