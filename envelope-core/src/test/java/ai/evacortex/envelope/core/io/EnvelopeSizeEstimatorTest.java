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
import ai.evacortex.envelope.core.io.codec.ByteArrayPayloadCodec;
import ai.evacortex.envelope.core.io.codec.JacksonPayloadCodec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeSizeEstimatorTest {

    private static final EnvelopeFormat FORMAT = new EnvelopeFormat("1.0.0", 16);

    record Order(String id, List<String> items, double total) {}

    @Test
    void testHeaderSizeFollowsVersionWidth() {
        assertEquals(32, new EnvelopeSizeEstimator<>(FORMAT, ByteArrayPayloadCodec.INSTANCE).headerSize());
        assertEquals(80, new EnvelopeSizeEstimator<>(new EnvelopeFormat("1.0.0", 64),
                ByteArrayPayloadCodec.INSTANCE).headerSize());
    }

    @Test
    void testTotalSizeMatchesBytesWritten() throws IOException {
        EnvelopeSizeEstimator<byte[]> estimator = new EnvelopeSizeEstimator<>(FORMAT, ByteArrayPayloadCodec.INSTANCE);
        EnvelopeWriter<byte[]> writer = new EnvelopeWriter<>(FORMAT, ByteArrayPayloadCodec.INSTANCE);

        for (int size : new int[] {0, 3, 1024}) {
            byte[] payload = new byte[size];
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            long written = writer.write(out, payload);

            assertEquals(written, estimator.totalSize(payload));
            assertEquals(out.size(), estimator.totalSize(payload));
        }
    }

    @Test
    void testTotalSizeMatchesForJsonPayloads() throws IOException {
        JacksonPayloadCodec<Order> codec = new JacksonPayloadCodec<>(Order.class);
        EnvelopeSizeEstimator<Order> estimator = new EnvelopeSizeEstimator<>(FORMAT, codec);
        EnvelopeWriter<Order> writer = new EnvelopeWriter<>(FORMAT, codec);
        EnvelopeReader<Order> reader = new EnvelopeReader<>(FORMAT, codec);

        Order order = new Order("o-991", List.of("lamp", "cable", "bulb"), 42.75);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(estimator.totalSize(order), writer.write(out, order));
        assertEquals(estimator.totalSize(order), out.size());
        assertEquals(order, reader.read(new ByteArrayInputStream(out.toByteArray())));
    }
}
