package com.ecoauditor;

import ch.qos.logback.classic.Level;
import com.ecoauditor.cli.AuditCommand;
import com.ecoauditor.cli.GraphCommand;
import com.ecoauditor.cli.ListCommand;
import com.ecoauditor.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the ecosystem auditor.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code audit} - Run all selected checks, including link probing</li>
 *   <li>{@code validate} - Offline metadata, graph and statistics checks</li>
 *   <li>{@code graph} - Describe the dependency graph as Mermaid or JSON</li>
 *   <li>{@code list} - List available rules, generators, formatters or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ecoauditor audit ecosystem-index.json --overrides repos/ -f json -o audit.json
 * ecoauditor validate ecosystem-index.json
 * ecoauditor graph ecosystem-index.json --format mermaid -o docs/
 * ecoauditor list rules
 * }</pre>
 */
@Command(
    name = "ecoauditor",
    mixinStandardHelpOptions = true,
    version = "Ecosystem Auditor 1.0.0-SNAPSHOT",
    description = "Consistency auditor for a declared ecosystem of repositories",
    subcommands = {
        AuditCommand.class,
        ValidateCommand.class,
        GraphCommand.class,
        ListCommand.class
    }
)
public class EcoAuditorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EcoAuditorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Ecosystem Auditor 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'ecoauditor --help' to see available commands");
        System.out.println("Use 'ecoauditor <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        EcoAuditorCLI cli = new EcoAuditorCLI();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
