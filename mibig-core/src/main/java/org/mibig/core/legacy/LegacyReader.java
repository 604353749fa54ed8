package org.mibig.core.legacy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mibig.core.error.LegacyFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads MIBiG v3 JSON into {@link LegacyEntry}.
 *
 * <p>v3 documents are loosely typed: some fields hold either a string or a list of strings, so
 * single values are accepted wherever a list is expected. Unknown fields are ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LegacyEntry entry = LegacyReader.read(Path.of("BGC0000001.json"));
 * }</pre>
 */
public final class LegacyReader {

    private static final Logger log = LoggerFactory.getLogger(LegacyReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private LegacyReader() {
        // Utility class
    }

    /**
     * Reads a v3 document from a file.
     *
     * @param file path to the JSON file
     * @return the decoded document
     * @throws LegacyFormatException if the file cannot be read or does not have the v3 shape
     */
    public static LegacyEntry read(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new LegacyFormatException("Cannot read legacy entry: " + file);
        }
        log.debug("Reading legacy entry from: {}", file);
        try {
            return MAPPER.readValue(file.toFile(), LegacyEntry.class);
        } catch (IOException e) {
            throw wrap(file.toString(), e);
        }
    }

    /**
     * Reads a v3 document from JSON text.
     */
    public static LegacyEntry read(String json) {
        try {
            return MAPPER.readValue(json, LegacyEntry.class);
        } catch (JsonProcessingException e) {
            throw wrap("<string>", e);
        }
    }

    public static LegacyEntry read(JsonNode node) {
        try {
            return MAPPER.treeToValue(node, LegacyEntry.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw wrap("<tree>", e);
        }
    }

    private static LegacyFormatException wrap(String source, Exception e) {
        // Checks thrown by the record constructors arrive wrapped by Jackson
        if (e instanceof JsonMappingException && e.getCause() instanceof LegacyFormatException cause) {
            return new LegacyFormatException(cause.getMessage() + " (" + source + ")", cause);
        }
        String message = e instanceof JsonProcessingException processing
            ? processing.getOriginalMessage()
            : e.getMessage();
        return new LegacyFormatException("Malformed legacy entry " + source + ": " + message, e);
    }
}
