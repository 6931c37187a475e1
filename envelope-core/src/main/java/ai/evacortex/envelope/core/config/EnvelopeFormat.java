/*
 * Envelope — Versioned Binary Payload Format
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.envelope.core.config;

import ai.evacortex.envelope.core.exceptions.VersionOverflowException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * EnvelopeFormat describes one generation of the envelope header: the version
 * string the running software stamps into every header, the fixed capacity of
 * the version field, and the ceiling used for bounded reads.
 *
 * <p>
 * Formats are plain values. Nothing in the codec reads a global version, so
 * several generations can live side by side, e.g. an "old" reader and a "new"
 * writer in the same test.
 * </p>
 *
 * <h3>Loading</h3>
 * A format is usually loaded from JSON:
 * <pre>
 * { "version": "1.0.0", "maxVersionLength": 16, "maxMarshalledSize": 1073741824 }
 * </pre>
 * {@code maxMarshalledSize} is optional and defaults to 1 GiB.
 *
 * @param version           current software version, ASCII, shorter than {@code maxVersionLength}
 * @param maxVersionLength  width in bytes of the version field (MAXLEN)
 * @param maxMarshalledSize upper bound of a single envelope, used to size bounded read windows
 */
public record EnvelopeFormat(String version, int maxVersionLength, long maxMarshalledSize) {

    public static final long DEFAULT_MAX_MARSHALLED_SIZE = 1024L * 1024 * 1024;
    public static final String DEFAULT_RESOURCE = "envelope-format.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public EnvelopeFormat {
        if (version == null || version.isBlank())
            throw new IllegalArgumentException("Envelope version must not be blank");
        if (maxVersionLength <= 0)
            throw new IllegalArgumentException("Unsupported version field length: " + maxVersionLength);
        if (maxMarshalledSize <= 0)
            throw new IllegalArgumentException("maxMarshalledSize must be positive: " + maxMarshalledSize);
        for (int i = 0; i < version.length(); i++) {
            char c = version.charAt(i);
            if (c == 0 || c > 0x7F)
                throw new IllegalArgumentException("Envelope version must be printable ASCII: " + version);
        }
        if (version.length() >= maxVersionLength)
            throw new VersionOverflowException(version, maxVersionLength);
    }

    public EnvelopeFormat(String version, int maxVersionLength) {
        this(version, maxVersionLength, DEFAULT_MAX_MARSHALLED_SIZE);
    }

    @JsonCreator
    public static EnvelopeFormat of(@JsonProperty("version") String version,
                                    @JsonProperty("maxVersionLength") int maxVersionLength,
                                    @JsonProperty("maxMarshalledSize") Long maxMarshalledSize) {
        return new EnvelopeFormat(version, maxVersionLength,
                maxMarshalledSize != null ? maxMarshalledSize : DEFAULT_MAX_MARSHALLED_SIZE);
    }

    /** Width of a header written by this generation: version field plus two u64 size fields. */
    public int headerSize() {
        return maxVersionLength + 2 * Long.BYTES;
    }

    public static EnvelopeFormat load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, EnvelopeFormat.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load envelope format: " + path, e);
        }
    }

    public static EnvelopeFormat fromResource(String resource) {
        ClassLoader loader = EnvelopeFormat.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Envelope format resource not found: " + resource);
            return MAPPER.readValue(in, EnvelopeFormat.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load envelope format resource: " + resource, e);
        }
    }

    public static EnvelopeFormat defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }
}
