package org.mibig.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared Jackson mapper and file helpers for MIBiG JSON documents.
 *
 * <p>The mapper is thread-safe and reused across all reads and writes.
 */
public final class MibigJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);

    private MibigJson() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses a JSON file into a tree.
     *
     * @param file file to read
     * @return root node
     * @throws IOException if the file cannot be read or parsed
     */
    public static JsonNode readTree(Path file) throws IOException {
        return MAPPER.readTree(file.toFile());
    }

    public static JsonNode readTree(String content) throws IOException {
        return MAPPER.readTree(content);
    }

    /**
     * Serializes a tree to a string.
     *
     * @param node tree to write
     * @param pretty whether to indent the output
     * @return JSON text
     * @throws IOException if serialization fails
     */
    public static String write(JsonNode node, boolean pretty) throws IOException {
        if (pretty) {
            return MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(node);
        }
        return MAPPER.writeValueAsString(node);
    }

    /**
     * Writes a tree to a file, creating parent directories as needed.
     */
    public static void write(JsonNode node, Path file, boolean pretty, boolean trailingNewline) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String content = write(node, pretty);
        if (trailingNewline) {
            content = content + System.lineSeparator();
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
