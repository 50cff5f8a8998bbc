package com.logix.laad.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads LNJ text back into {@link LnjDocument} POJOs or a plain JSON tree.
 */
public final class LnjReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LnjReader() {
        // Utility class
    }

    public static LnjDocument parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static LnjDocument parse(String json) throws IOException {
        LnjDocument doc = MAPPER.readValue(json, LnjDocument.class);
        if (doc.getLnj() == null)
            throw new IllegalArgumentException("Missing 'lnj' key");
        return doc;
    }

    public static JsonNode tree(String json) throws IOException {
        return MAPPER.readTree(json);
    }

    public static String write(JsonNode tree, boolean prettyPrint) throws IOException {
        return prettyPrint ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                : MAPPER.writeValueAsString(tree);
    }
}
