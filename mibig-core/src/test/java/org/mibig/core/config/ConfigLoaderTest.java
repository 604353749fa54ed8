package org.mibig.core.config;

import org.mibig.core.error.ValidationException;
import org.mibig.core.validation.QualityLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              prettyPrint: false
              trailingNewline: false

            validation:
              quality: medium
            """);

        ConverterConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().prettyPrint()).isFalse();
        assertThat(config.output().trailingNewline()).isFalse();
        assertThat(config.validation().qualityLevel()).contains(QualityLevel.MEDIUM);
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              prettyPrint: false
            """);

        ConverterConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().prettyPrint()).isFalse();
        assertThat(config.output().trailingNewline()).isTrue();
        assertThat(config.validation().qualityLevel()).isEmpty();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            legacy:
              directory: ./v3
            output:
              trailingNewline: false
              indent: 4
            """);

        ConverterConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().trailingNewline()).isFalse();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ConverterConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ConverterConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ConverterConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              prettyPrint: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ConverterConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ConverterConfig.defaults());
    }

    @Test
    void qualityLevel_unknownTier_throws() {
        ConverterConfig.ValidationConfig validation = new ConverterConfig.ValidationConfig("excellent");

        assertThatThrownBy(validation::qualityLevel)
            .isInstanceOf(ValidationException.class);
    }
}
