package com.apischema;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ApiSchemaCLI}.
 */
class ApiSchemaCLITest {

    @Test
    void version_printsVersion() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = ApiSchemaCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("apischema 1.0.0-SNAPSHOT");
    }

    @Test
    void help_listsSubcommands() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = ApiSchemaCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("generate").contains("resolve");
    }

    @Test
    void globalOptions_areParsed() {
        ApiSchemaCLI cli = new ApiSchemaCLI();
        new CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void unknownOption_isUsageError() {
        StringWriter err = new StringWriter();
        CommandLine commandLine = ApiSchemaCLI.commandLine();
        commandLine.setErr(new PrintWriter(err));

        int exitCode = commandLine.execute("--bogus");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--bogus");
    }
}
