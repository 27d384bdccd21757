package com.all2md;

import com.all2md.cli.ConvertCommand;
import com.all2md.cli.EditCommand;
import com.all2md.cli.ListCommand;
import com.all2md.cli.SectionsCommand;
import com.all2md.cli.SplitCommand;
import com.all2md.cli.TocCommand;
import com.all2md.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for all2md.
 *
 * <p>all2md reads documents into a format-neutral tree and edits, splits, validates and
 * converts them through that tree.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code sections} - List sections with their selectors</li>
 *   <li>{@code edit} - Extract, add, remove, replace or insert into sections</li>
 *   <li>{@code toc} - Generate or insert a table of contents</li>
 *   <li>{@code split} - Split a document into several files</li>
 *   <li>{@code validate} - Report structural problems</li>
 *   <li>{@code convert} - Convert between registered formats</li>
 *   <li>{@code list} - List available parsers, renderers, or writers</li>
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
 * # Show the section outline
 * all2md sections README.md
 *
 * # Remove a section and print the result
 * all2md edit README.md --action remove --target "Old Notes"
 *
 * # Split into one file per chapter with debug logging
 * all2md -v split book.md --by h1 -o chapters
 * }</pre>
 */
@Command(
    name = "all2md",
    mixinStandardHelpOptions = true,
    version = "all2md 1.0.0-SNAPSHOT",
    description = "Edit, split, validate and convert documents through a shared document tree",
    subcommands = {
        SectionsCommand.class,
        EditCommand.class,
        TocCommand.class,
        SplitCommand.class,
        ValidateCommand.class,
        ConvertCommand.class,
        ListCommand.class
    }
)
public class All2MdCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(All2MdCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("all2md - document tree editing and conversion");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'all2md --help' to see available commands");
        System.out.println("Use 'all2md <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
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
     * Builds the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        All2MdCLI cli = new All2MdCLI();
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
