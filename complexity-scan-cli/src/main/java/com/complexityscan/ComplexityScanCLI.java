package com.complexityscan;

import ch.qos.logback.classic.Level;
import com.complexityscan.cli.LanguagesCommand;
import com.complexityscan.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for complexity-scan.
 *
 * <p>complexity-scan walks a source tree, parses every recognized file with a tree-sitter
 * grammar and reports cyclomatic and cognitive complexity per function, per file and for
 * the whole repository as JSON.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a directory and emit the JSON report</li>
 *   <li>{@code languages} - List supported languages and extensions</li>
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
 * # Scan current directory
 * complexity-scan scan .
 *
 * # Scan with verbose output and write the report to a file
 * complexity-scan -v scan /path/to/repo -o complexity.json
 *
 * # List supported languages
 * complexity-scan languages
 * }</pre>
 */
@Command(
    name = "complexity-scan",
    mixinStandardHelpOptions = true,
    version = "complexity-scan 1.0.0-SNAPSHOT",
    description = "Multi-language codebase complexity analyzer",
    exitCodeOnInvalidInput = ComplexityScanCLI.EXIT_USAGE,
    subcommands = {
        ScanCommand.class,
        LanguagesCommand.class
    }
)
public class ComplexityScanCLI implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_ROOT_NOT_FOUND = 2;
    public static final int EXIT_TIMEOUT = 3;
    public static final int EXIT_USAGE = 64;

    private static final Logger log = LoggerFactory.getLogger(ComplexityScanCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("complexity-scan - Multi-language codebase complexity analyzer");
        spec.commandLine().getOut().println("Use 'complexity-scan --help' to see available commands");
        spec.commandLine().getOut().flush();
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Builds the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        ComplexityScanCLI cli = new ComplexityScanCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
