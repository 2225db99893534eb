package org.tims.tools;

import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for the TIMS conversion command-line tools.
 */
@Command(
    name = "tims",
    mixinStandardHelpOptions = true,
    version = "TIMS Toolkit 1.0.0",
    description = "Convert timsTOF acquisitions to mzML and imzML",
    subcommands = {
        ConvertCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class TimsMain implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TimsMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When called without subcommand, show help
        CommandLine.usage(this, System.out);
    }

    /**
     * Lowers the root log level to DEBUG when {@code --verbose} was given.
     */
    void applyLogLevel() {
        if (verbose) {
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }
}
