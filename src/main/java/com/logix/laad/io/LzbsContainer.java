package com.logix.laad.io;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.LZMAInputStream;
import org.tukaani.xz.LZMAOutputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.undercouch.bson4jackson.BsonFactory;
import lombok.extern.log4j.Log4j2;

/**
 * LZBS container: an LNJ document encoded as BSON, then compressed as a raw
 * {@code .lzma} stream with an end marker.
 *
 * <p>
 * {@link #decode(byte[])} inverts both steps. The result is semantically equal to the
 * encoded tree; key order and number formatting of the original text are not kept.
 */
@Log4j2
public final class LzbsContainer {
    private static final ObjectMapper BSON = new ObjectMapper(new BsonFactory());

    private LzbsContainer() {
        // Utility class
    }

    public static byte[] encode(JsonNode lnj) throws IOException {
        if (!lnj.isObject())
            throw new IllegalArgumentException("An LZBS document must be a JSON object");
        byte[] bson = BSON.writeValueAsBytes(lnj);
        ByteArrayOutputStream out = new ByteArrayOutputStream(bson.length / 2 + 64);
        try (LZMAOutputStream lzma = new LZMAOutputStream(out, new LZMA2Options(), -1)) {
            lzma.write(bson);
        }
        log.debug("Encoded LZBS: {} bytes of BSON -> {} bytes", bson.length, out.size());
        return out.toByteArray();
    }

    public static JsonNode decode(byte[] container) throws IOException {
        byte[] bson;
        try (InputStream lzma = new LZMAInputStream(new ByteArrayInputStream(container))) {
            bson = lzma.readAllBytes();
        }
        log.debug("Decoded LZBS: {} bytes -> {} bytes of BSON", container.length, bson.length);
        return BSON.readTree(bson);
    }
}
