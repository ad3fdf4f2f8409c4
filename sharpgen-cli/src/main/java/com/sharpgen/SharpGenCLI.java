package com.sharpgen;

import com.sharpgen.cli.GenerateCommand;
import com.sharpgen.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for SharpGen.
 *
 * <p>SharpGen turns declarative models of C# types (classes, interfaces, members) into
 * formatted C# source files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate C# sources from a model file</li>
 *   <li>{@code list} - List available generators or renderers</li>
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
 * # Generate sources into ./generated
 * sharpgen generate -i model.yaml
 *
 * # Print sources instead of writing them
 * sharpgen generate -i model.json --stdout
 *
 * # List available generators
 * sharpgen list generators
 * }</pre>
 */
@Command(
    name = "sharpgen",
    mixinStandardHelpOptions = true,
    version = "SharpGen 1.0.0-SNAPSHOT",
    description = "Declarative C# source code generator",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class
    }
)
public class SharpGenCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SharpGenCLI.class);

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

        System.out.println("SharpGen - Declarative C# Source Code Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sharpgen --help' to see available commands");
        System.out.println("Use 'sharpgen <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Called by the root command and by every subcommand before it starts working.
     */
    public void configureLogging() {
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
     * Creates the command line with enum values matched case-insensitively.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new SharpGenCLI())
            .setCaseInsensitiveEnumValuesAllowed(true);
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
