package com.semanticdiff;

import com.semanticdiff.cli.AnalyzeCommand;
import com.semanticdiff.cli.DiffCommand;
import com.semanticdiff.cli.MergeCommand;
import com.semanticdiff.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for SemanticDiff.
 *
 * <p>SemanticDiff compares, merges and cross-checks ontology models stored in the JSON
 * interchange format.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code diff} - Structural diff of two model versions</li>
 *   <li>{@code merge} - Three-way merge of two edits of a common base</li>
 *   <li>{@code analyze} - Semantic debt analysis across a directory of models</li>
 *   <li>{@code validate} - Check models for malformed or duplicate elements</li>
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
 * # Changelog between two versions
 * semanticdiff diff -s sales-v1.json -t sales-v2.json
 *
 * # Merge two branches, preferring theirs on conflicts
 * semanticdiff merge -b base.json -o ours.json -t theirs.json --strategy theirs --out merged.json
 *
 * # Semantic debt across all models in a directory
 * semanticdiff analyze -i ./ontologies
 * }</pre>
 */
@Command(
    name = "semanticdiff",
    mixinStandardHelpOptions = true,
    version = "SemanticDiff 1.0.0-SNAPSHOT",
    description = "Structural diff, three-way merge and semantic debt analysis for ontology models",
    subcommands = {
        DiffCommand.class,
        MergeCommand.class,
        AnalyzeCommand.class,
        ValidateCommand.class
    }
)
public class SemanticDiffCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SemanticDiffCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("SemanticDiff - Ontology Diff, Merge and Semantic Debt Analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'semanticdiff --help' to see available commands");
        System.out.println("Use 'semanticdiff <command> --help' for command-specific help");
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

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        SemanticDiffCLI cli = new SemanticDiffCLI();
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
