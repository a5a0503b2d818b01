package com.codelens;

import ch.qos.logback.classic.Level;
import com.codelens.cli.AnalyzeCommand;
import com.codelens.cli.IndexCommand;
import com.codelens.cli.QueryCommand;
import com.codelens.cli.WorkflowsCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CodeLens.
 *
 * <p>CodeLens analyzes a Python codebase, tags its files and functions with business domain
 * concepts, detects workflows along the call graph, and answers queries against the
 * resulting semantic index.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Parse a project and export the structural analysis</li>
 *   <li>{@code index} - Build and save the semantic index of a project</li>
 *   <li>{@code query} - Rank indexed entities against a query</li>
 *   <li>{@code workflows} - List detected workflows</li>
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
 * codelens index ./erpnext -o ./out
 * codelens query ./out/erpnext_semantic_index.json "ledger posting"
 * codelens -v workflows ./out/erpnext_semantic_index.json
 * }</pre>
 */
@Command(
    name = "codelens",
    mixinStandardHelpOptions = true,
    version = "CodeLens 1.0.0-SNAPSHOT",
    description = "Structural and semantic analysis of Python codebases",
    subcommands = {
        AnalyzeCommand.class,
        IndexCommand.class,
        QueryCommand.class,
        WorkflowsCommand.class
    }
)
public class CodeLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeLensCLI.class);

    static final String PROJECT_LOGGER_NAME = "com.codelens";

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("CodeLens - Structural and semantic analysis of Python codebases");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codelens --help' to see available commands");
        System.out.println("Use 'codelens <command> --help' for command-specific help");
    }

    /**
     * Applies the global options to the root logger and to the {@code com.codelens} logger,
     * which logback.xml configures separately.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Logger project =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(PROJECT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
            project.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
            project.setLevel(Level.DEBUG);
        } else {
            project.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", project.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line. Global options are applied before the selected subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeLensCLI cli = new CodeLensCLI();
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
        System.exit(commandLine().execute(args));
    }
}
