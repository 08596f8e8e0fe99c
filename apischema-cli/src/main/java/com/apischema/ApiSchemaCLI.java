package com.apischema;

import com.apischema.cli.GenerateCommand;
import com.apischema.cli.ResolveCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for apischema.
 *
 * <p>Reads a YAML API definition and prints the versioned API description it documents.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate the API document for a version</li>
 *   <li>{@code resolve} - Show which descriptor a family selects for a version</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Document version 1.7 as YAML
 * apischema generate api.yaml --api-version 1.7 --format yaml
 *
 * # Which response shape does 1.5 get?
 * apischema resolve api.yaml UserResponse 1.5
 * }</pre>
 */
@Command(
    name = "apischema",
    mixinStandardHelpOptions = true,
    version = "apischema 1.0.0-SNAPSHOT",
    description = "Versioned API description generator",
    subcommands = {
        GenerateCommand.class,
        ResolveCommand.class
    }
)
public class ApiSchemaCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ApiSchemaCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("apischema - Versioned API description generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'apischema --help' to see available commands");
        System.out.println("Use 'apischema <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the logging-aware execution strategy.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ApiSchemaCLI cli = new ApiSchemaCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
