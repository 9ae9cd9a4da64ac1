package org.unchartedlands.simulation;

import org.unchartedlands.simulation.cli.CommandLineInterface;
import picocli.CommandLine;

/**
 * The main entry point of the standalone simulation node.
 * <p>
 * Delegates argument parsing and the node lifecycle to {@link CommandLineInterface}.
 */
public final class Main {

    private Main() {
        // This class should not be instantiated.
    }

    /**
     * @param args The command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
