package com.phillippitts.speaktoavatar.service.protocol;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Gzip helpers for frame payloads. */
public final class GzipCodec {

    private GzipCodec() {
    }

    public static byte[] compress(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        } catch (IOException e) {
            // in-memory streams only fail on programming errors
            throw new UncheckedIOException("gzip compression failed", e);
        }
        return out.toByteArray();
    }

    /**
     * @throws IOException if the bytes are not a valid gzip stream
     */
    public static byte[] decompress(byte[] data) throws IOException {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gzip.readAllBytes();
        }
    }
}
