package com.depintel;

import ch.qos.logback.classic.Level;
import com.depintel.cli.AnalyzeCommand;
import com.depintel.cli.ListCommand;
import com.depintel.cli.RecommendCommand;
import com.depintel.cli.UpdateCommand;
import com.depintel.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the dependency intelligence engine.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Run one or more analyses over a project snapshot</li>
 *   <li>{@code recommend} - Run every analysis and print the ranked recommendations</li>
 *   <li>{@code update} - List available updates with their compatibility scores</li>
 *   <li>{@code list} - List installed analyzers</li>
 *   <li>{@code validate} - Check that a snapshot resolves into a dependency graph</li>
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
 * # Check licenses against Apache-2.0
 * depintel analyze snapshot.yaml -t license_compliance --set target_license=Apache-2.0
 *
 * # Everything, with results written as JSON
 * depintel -v analyze snapshot.yaml -o build/depintel
 *
 * # Ranked recommendations
 * depintel recommend snapshot.yaml
 * }</pre>
 */
@Command(
    name = "depintel",
    mixinStandardHelpOptions = true,
    version = "DepIntel 1.0.0-SNAPSHOT",
    description = "Dependency intelligence: impact, compatibility, consolidation, health, license and performance analysis",
    subcommands = {
        AnalyzeCommand.class,
        RecommendCommand.class,
        UpdateCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class DepIntelCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("DepIntel - Dependency Intelligence Engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'depintel --help' to see available commands");
        System.out.println("Use 'depintel <command> --help' for command-specific help");
    }

    /**
     * Applies the global verbosity options to the Logback root logger.
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

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DepIntelCLI cli = new DepIntelCLI();
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
