package com.columnhierarchy;

import com.columnhierarchy.cli.ListCommand;
import com.columnhierarchy.cli.ResolveCommand;
import com.columnhierarchy.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point.
 *
 * <p>Derives a record-type hierarchy from column sets and emits it as Java sources,
 * JSON Schema, Mermaid diagrams or a plain-text report.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code resolve} - Resolve column sets into a type hierarchy</li>
 *   <li>{@code list} - List available emitters or renderers</li>
 *   <li>{@code validate} - Validate configuration, input and registry files</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * column-hierarchy resolve columns.txt
 * column-hierarchy -v resolve columns.yaml -m anchored -r registry.yaml
 * column-hierarchy list emitters
 * }</pre>
 */
@Command(
    name = "column-hierarchy",
    mixinStandardHelpOptions = true,
    version = "Column Hierarchy 1.0.0-SNAPSHOT",
    description = "Derives a minimal-redundancy record-type hierarchy from column sets",
    subcommands = {
        ResolveCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class ColumnHierarchyCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ColumnHierarchyCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("Column Hierarchy - record-type hierarchy resolver");
        System.out.println("Use 'column-hierarchy --help' to see available commands");
    }

    /**
     * Sets the Logback root level from the global options.
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ColumnHierarchyCLI cli = new ColumnHierarchyCLI();
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
