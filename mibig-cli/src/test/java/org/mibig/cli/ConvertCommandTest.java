package org.mibig.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.MibigCLI;
import org.mibig.core.json.MibigJson;
import org.mibig.core.model.entry.MibigEntry;
import org.mibig.core.validation.QualityLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConvertCommand}.
 */
class ConvertCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void convert_legacyEntry_writesValidEntry() throws IOException, URISyntaxException {
        Path output = tempDir.resolve("out").resolve("BGC0000055.json");

        int exitCode = execute("convert", resource("/legacy/BGC0000055.json").toString(), output.toString());

        assertThat(exitCode).isZero();
        assertThat(output).exists();
        MibigEntry entry = MibigEntry.decode(MibigJson.readTree(output));
        assertThat(entry.accession()).isEqualTo("BGC0000055");
        assertThat(entry.quality()).isEqualTo(QualityLevel.QUESTIONABLE);
    }

    @Test
    void convert_defaultConfig_writesIndentedJsonWithTrailingNewline() throws IOException, URISyntaxException {
        Path output = tempDir.resolve("BGC0000055.json");

        execute("convert", resource("/legacy/BGC0000055.json").toString(), output.toString());

        String content = Files.readString(output);
        assertThat(content).contains("\n  \"accession\"");
        assertThat(content).endsWith(System.lineSeparator());
    }

    @Test
    void convert_compactConfig_writesSingleLine() throws IOException, URISyntaxException {
        Path config = tempDir.resolve("mibig.yaml");
        Files.writeString(config, """
            output:
              prettyPrint: false
              trailingNewline: false
            """);
        Path output = tempDir.resolve("BGC0000055.json");

        int exitCode = execute("-c", config.toString(),
            "convert", resource("/legacy/BGC0000055.json").toString(), output.toString());

        assertThat(exitCode).isZero();
        String content = Files.readString(output);
        assertThat(content).doesNotContain("\n");
        JsonNode node = MibigJson.readTree(content);
        assertThat(node.get("accession").asText()).isEqualTo("BGC0000055");
    }

    @Test
    void convert_malformedInput_returnsError() throws IOException {
        Path input = tempDir.resolve("broken.json");
        Files.writeString(input, "{\"cluster\": ");
        Path output = tempDir.resolve("out.json");

        int exitCode = execute("convert", input.toString(), output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void convert_unmigratableEntry_returnsError() throws IOException {
        Path input = tempDir.resolve("BGC0000002.json");
        Files.writeString(input, """
            {
              "changelog": [{"comments": ["Submitted"], "contributors": ["AAAAAAAAAAAAAAAAAAAAAAAA"], "version": "1.0"}],
              "cluster": {
                "biosyn_class": ["Other"],
                "mibig_accession": "BGC0000002",
                "loci": {"accession": "JF752342.1", "completeness": "mostly"},
                "ncbi_tax_id": "536",
                "organism_name": "Chromobacterium violaceum"
              }
            }
            """);
        Path output = tempDir.resolve("out.json");

        int exitCode = execute("convert", input.toString(), output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void convert_missingArguments_returnsUsageError() {
        int exitCode = execute("convert");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    static int execute(String... args) {
        return new CommandLine(new MibigCLI()).execute(args);
    }

    private Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getResource(name).toURI());
    }
}
