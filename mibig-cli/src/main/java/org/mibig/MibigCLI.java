package org.mibig;

import ch.qos.logback.classic.Level;
import org.mibig.cli.ConvertCommand;
import org.mibig.cli.ValidateCommand;
import org.mibig.core.config.ConfigLoader;
import org.mibig.core.config.ConverterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main CLI entry point for the MIBiG tools.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Migrate a MIBiG v3 entry to the current schema</li>
 *   <li>{@code validate} - Validate a current-schema entry</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code -c, --config} - Configuration file (default: mibig.yaml)</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert a v3 entry
 * mibig convert BGC0000001.json BGC0000001.v4.json
 *
 * # Validate with debug logging
 * mibig -v validate BGC0000001.v4.json
 * }</pre>
 */
@Command(
    name = "mibig",
    mixinStandardHelpOptions = true,
    version = "MIBiG 4.0.0-SNAPSHOT",
    description = "MIBiG entry migration and validation",
    subcommands = {
        ConvertCommand.class,
        ValidateCommand.class
    }
)
public class MibigCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MibigCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: mibig.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Spec
    private CommandSpec spec;

    /**
     * Without a subcommand, prints usage.
     */
    @Override
    public void run() {
        configureLogging();
        if (!quiet) {
            spec.commandLine().usage(System.out);
        }
    }

    /**
     * Configures logging level based on global options. Subcommands call this before they run.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Loads the configuration named by {@code --config}, or defaults.
     */
    public ConverterConfig loadConfig() {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MibigCLI()).execute(args);
        System.exit(exitCode);
    }
}
