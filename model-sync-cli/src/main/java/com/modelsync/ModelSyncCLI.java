package com.modelsync;

import com.modelsync.cli.ConvertCommand;
import com.modelsync.cli.PaletteCommand;
import com.modelsync.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for model-sync.
 *
 * <p>Runs the text to diagram pipeline outside an editor: converts a parsed model to a
 * diagram, validates descriptors and diagrams, and prints tool palettes.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert an AST file into a diagram snapshot</li>
 *   <li>{@code validate} - Lint a language descriptor and validate a diagram</li>
 *   <li>{@code palette} - Print the tool palette of a language</li>
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
 * model-sync convert model.ast.json -d ecml.yaml --layout tree
 * model-sync validate ecml.yaml --ast model.ast.json
 * }</pre>
 */
@Command(
    name = "model-sync",
    mixinStandardHelpOptions = true,
    version = "model-sync 1.0.0-SNAPSHOT",
    description = "Text and diagram synchronization engine",
    subcommands = {
        ConvertCommand.class,
        ValidateCommand.class,
        PaletteCommand.class
    }
)
public class ModelSyncCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ModelSyncCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("model-sync - Text and diagram synchronization engine");
        System.out.println("Use 'model-sync --help' to see available commands");
    }

    /**
     * Sets the root log level from the global options. Runs before any subcommand.
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
     * Builds the command line with logging configured before the selected command runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        ModelSyncCLI cli = new ModelSyncCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
