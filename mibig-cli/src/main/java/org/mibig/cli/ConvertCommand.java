package org.mibig.cli;

import org.mibig.MibigCLI;
import org.mibig.core.config.ConverterConfig;
import org.mibig.core.error.LegacyFormatException;
import org.mibig.core.error.MigrationException;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.MibigJson;
import org.mibig.core.legacy.LegacyEntry;
import org.mibig.core.legacy.LegacyReader;
import org.mibig.core.migration.EntryMigrator;
import org.mibig.core.model.entry.MibigEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Converts one MIBiG v3 entry into a current-schema entry.
 *
 * <p>The entry is read, migrated, validated at its own (questionable) tier and written. Nothing
 * is written when any step fails.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * mibig convert BGC0000001.json out/BGC0000001.json
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert a MIBiG v3 JSON entry to the current schema",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @ParentCommand
    private MibigCLI parent;

    @Parameters(index = "0", description = "Input file (MIBiG v3 JSON)")
    private Path input;

    @Parameters(index = "1", description = "Output file (current MIBiG JSON)")
    private Path output;

    @Override
    public Integer call() {
        ConverterConfig config = ConverterConfig.defaults();
        if (parent != null) {
            parent.configureLogging();
            config = parent.loadConfig();
        }

        try {
            log.info("Converting {} to {}", input, output);
            LegacyEntry legacy = LegacyReader.read(input);
            MibigEntry entry = new EntryMigrator().migrate(legacy);
            entry.context(null).check(entry);

            MibigJson.write(entry.toJson(), output,
                config.output().prettyPrint(), config.output().trailingNewline());
            System.out.println("✓ Converted " + entry.accession() + " to " + output);
            return 0;
        } catch (ValidationException e) {
            log.error("Converted entry from {} is invalid", input);
            System.err.println("✗ Converted entry is invalid:");
            for (ValidationErrorInfo error : e.getErrors()) {
                System.err.println("✗ " + error.field() + ": " + error.message());
            }
            return 1;
        } catch (LegacyFormatException | MigrationException e) {
            log.error("Conversion of {} failed: {}", input, e.getMessage());
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write {}", output, e);
            System.err.println("✗ Failed to write " + output + ": " + e.getMessage());
            return 1;
        }
    }
}
