package com.sqlsignal;

import ch.qos.logback.classic.Level;
import com.sqlsignal.cli.AnalyzeCommand;
import com.sqlsignal.cli.CallGraphCommand;
import com.sqlsignal.cli.CallersCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SQL Signal.
 *
 * <p>SQL Signal reads T-SQL objects and reports transaction, data-change and error-handling
 * signals, control flow, migration impacts and call graphs. Raw SQL is never echoed.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a single object</li>
 *   <li>{@code call-graph} - Build the call graph of a batch</li>
 *   <li>{@code callers} - Find the callers of a target</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 */
@Command(
    name = "sqlsignal",
    mixinStandardHelpOptions = true,
    version = "SQL Signal 1.0.0-SNAPSHOT",
    description = "T-SQL signal extraction and call graph analysis",
    subcommands = {
        AnalyzeCommand.class,
        CallGraphCommand.class,
        CallersCommand.class
    }
)
public class SqlSignalCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("SQL Signal - T-SQL signal extraction and call graph analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sqlsignal --help' to see available commands");
        System.out.println("Use 'sqlsignal <command> --help' for command-specific help");
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
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SqlSignalCLI cli = new SqlSignalCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
        System.exit(commandLine().execute(args));
    }
}
