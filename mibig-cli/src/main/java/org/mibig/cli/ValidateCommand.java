package org.mibig.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.MibigCLI;
import org.mibig.core.config.ConverterConfig;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.MibigJson;
import org.mibig.core.model.entry.MibigEntry;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Validates a current-schema entry and reports every violation.
 *
 * <p>The entry is validated at its own quality tier unless {@code validation.quality} is set in
 * the configuration.
 */
@Command(
    name = "validate",
    description = "Validate a current-schema MIBiG JSON entry",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private MibigCLI parent;

    @Parameters(index = "0", description = "Entry file to validate")
    private Path entryFile;

    @Override
    public Integer call() {
        ConverterConfig config = ConverterConfig.defaults();
        if (parent != null) {
            parent.configureLogging();
            config = parent.loadConfig();
        }

        JsonNode node;
        try {
            node = MibigJson.readTree(entryFile);
        } catch (IOException e) {
            log.error("Failed to read {}", entryFile, e);
            System.err.println("✗ Cannot read " + entryFile + ": " + e.getMessage());
            return 1;
        }

        try {
            MibigEntry entry = MibigEntry.fromJson(node);
            Optional<QualityLevel> forced = config.validation().qualityLevel();
            ValidationContext context = forced.map(ValidationContext::of).orElseGet(() -> entry.context(null));
            log.debug("Validating {} at tier {}", entry.accession(), context.quality());

            List<ValidationErrorInfo> errors = entry.validate(context);
            if (!errors.isEmpty()) {
                return report(errors);
            }
            System.out.println("✓ " + entry.accession() + " is valid");
            return 0;
        } catch (ValidationException e) {
            return report(e.getErrors());
        }
    }

    private int report(List<ValidationErrorInfo> errors) {
        log.error("{} has {} violation(s)", entryFile, errors.size());
        for (ValidationErrorInfo error : errors) {
            System.err.println("✗ " + error.field() + ": " + error.message());
        }
        return 1;
    }
}
