package org.mibig.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.json.MibigJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mibig.cli.ConvertCommandTest.execute;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private ObjectNode document;

    @BeforeEach
    void loadDocument() throws IOException {
        document = (ObjectNode) MibigJson.mapper().readTree(getClass().getResource("/entries/BGC0000001.json"));
    }

    @Test
    void validate_validEntry_returnsSuccess() throws IOException {
        Path entry = write(document);

        assertThat(execute("validate", entry.toString())).isZero();
    }

    @Test
    void validate_invalidAccession_returnsError() throws IOException {
        document.put("accession", "BGC1");
        Path entry = write(document);

        assertThat(execute("validate", entry.toString())).isEqualTo(1);
    }

    @Test
    void validate_configuredQuality_overridesEntryQuality() throws IOException {
        document.put("quality", "questionable");
        removeLocusReferences();
        Path entry = write(document);
        Path config = tempDir.resolve("mibig.yaml");
        Files.writeString(config, """
            validation:
              quality: high
            """);

        assertThat(execute("validate", entry.toString())).isZero();
        assertThat(execute("-c", config.toString(), "validate", entry.toString())).isEqualTo(1);
    }

    @Test
    void validate_missingReferencesAtHighQuality_returnsError() throws IOException {
        removeLocusReferences();
        Path entry = write(document);
        Path config = tempDir.resolve("mibig.yaml");
        Files.writeString(config, """
            validation:
              quality: questionable
            """);

        assertThat(execute("validate", entry.toString())).isEqualTo(1);
        assertThat(execute("-c", config.toString(), "validate", entry.toString())).isZero();
    }

    @Test
    void validate_unreadableFile_returnsError() {
        assertThat(execute("validate", tempDir.resolve("missing.json").toString())).isEqualTo(1);
    }

    private void removeLocusReferences() {
        ((ObjectNode) document.get("loci").get(0).get("evidence").get(0)).remove("references");
    }

    private Path write(ObjectNode node) throws IOException {
        Path file = tempDir.resolve("entry.json");
        Files.writeString(file, MibigJson.write(node, true));
        return file;
    }
}
