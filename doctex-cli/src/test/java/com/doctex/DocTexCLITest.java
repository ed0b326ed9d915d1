package com.doctex;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocTexCLI} command wiring.
 */
class DocTexCLITest {

    @Test
    void commandLine_registersSubcommands() {
        CommandLine commandLine = DocTexCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsKeys("render", "validate", "list");
    }

    @Test
    void commandLine_unknownSubcommand_returnsUsageError() {
        int exitCode = DocTexCLI.commandLine().execute("publish");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void commandLine_version_returnsZero() {
        assertThat(DocTexCLI.commandLine().execute("--version")).isZero();
    }
}
