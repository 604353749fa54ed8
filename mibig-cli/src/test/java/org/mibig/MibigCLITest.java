package org.mibig;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MibigCLI}.
 */
class MibigCLITest {

    @Test
    void execute_noSubcommand_printsUsage() {
        assertThat(new CommandLine(new MibigCLI()).execute()).isZero();
    }

    @Test
    void execute_quietWithoutSubcommand_succeeds() {
        assertThat(new CommandLine(new MibigCLI()).execute("-q")).isZero();
    }

    @Test
    void execute_unknownSubcommand_returnsUsageError() {
        assertThat(new CommandLine(new MibigCLI()).execute("publish")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void subcommands_areRegistered() {
        assertThat(new CommandLine(new MibigCLI()).getSubcommands()).containsKeys("convert", "validate");
    }
}
