package com.doctex;

import ch.qos.logback.classic.Level;
import com.doctex.cli.ListCommand;
import com.doctex.cli.RenderCommand;
import com.doctex.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocTeX.
 *
 * <p>DocTeX renders a parsed document tree (JSON or YAML) into a ConTeXt source file.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a document tree to ConTeXt</li>
 *   <li>{@code validate} - Render without writing and report warnings and errors</li>
 *   <li>{@code list} - List templates, snippets, node kinds or renderers</li>
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
 * # Render with the default template
 * doctex render -i report.json -o build/tex
 *
 * # Print to the console with debug logging
 * doctex -v render -i report.json --stdout
 *
 * # List configured templates
 * doctex list templates -c doctex.yaml
 * }</pre>
 */
@Command(
    name = "doctex",
    mixinStandardHelpOptions = true,
    version = "DocTeX 1.0.0-SNAPSHOT",
    description = "Renders structured documents into ConTeXt",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class DocTexCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocTeX - ConTeXt document renderer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'doctex --help' to see available commands");
        System.out.println("Use 'doctex <command> --help' for command-specific help");
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
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured from the global options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocTexCLI cli = new DocTexCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
