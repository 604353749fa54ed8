package org.mibig.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.mibig.core.validation.QualityLevel;

import java.util.Optional;

/**
 * Root configuration of the MIBiG tools.
 *
 * <p>Loaded from {@code mibig.yaml}. Every key is optional.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * output:
 *   prettyPrint: true
 *   trailingNewline: true
 *
 * validation:
 *   quality: medium
 * }</pre>
 *
 * @param output how JSON documents are written
 * @param validation how entries are validated
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterConfig(
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("validation") ValidationConfig validation
) {
    public ConverterConfig {
        if (output == null) {
            output = OutputConfig.defaults();
        }
        if (validation == null) {
            validation = ValidationConfig.defaults();
        }
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig(OutputConfig.defaults(), ValidationConfig.defaults());
    }

    /**
     * @param prettyPrint indent written JSON, default true
     * @param trailingNewline end written files with a newline, default true
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("prettyPrint") Boolean prettyPrint,
        @JsonProperty("trailingNewline") Boolean trailingNewline
    ) {
        public OutputConfig {
            if (prettyPrint == null) {
                prettyPrint = true;
            }
            if (trailingNewline == null) {
                trailingNewline = true;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(true, true);
        }
    }

    /**
     * @param quality tier forced when validating, by wire value; absent means the entry's own
     *                quality governs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(@JsonProperty("quality") String quality) {

        public static ValidationConfig defaults() {
            return new ValidationConfig(null);
        }

        /**
         * @throws org.mibig.core.error.ValidationException if the configured tier is unknown
         */
        public Optional<QualityLevel> qualityLevel() {
            return Optional.ofNullable(quality).map(QualityLevel::fromValue);
        }
    }
}
