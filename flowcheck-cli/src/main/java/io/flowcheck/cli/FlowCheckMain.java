package io.flowcheck.cli;

import io.flowcheck.cli.commands.FlowCheckCLI;
import java.util.Date;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import picocli.CommandLine;

/// Process entry point. Exits with the status of the executed subcommand.
///
/// Analysis logs go to `System.err` at the level named by the `flowcheck.log.level`
/// system property, `WARNING` by default, so that reports on `System.out` stay clean.
public final class FlowCheckMain {

    static final String LOG_LEVEL_PROPERTY = "flowcheck.log.level";

    private FlowCheckMain() {}

    public static void main(String[] args) {
        configureLogging(Level.parse(System.getProperty(LOG_LEVEL_PROPERTY, "WARNING")));
        System.exit(new CommandLine(new FlowCheckCLI()).execute(args));
    }

    static void configureLogging(Level level) {
        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(level);
        consoleHandler.setFormatter(
                new SimpleFormatter() {
                    @Override
                    public String format(LogRecord record) {
                        return String.format(
                                "[%1$tF %1$tT.%1$tL] [%2$-7s] %3$s - %4$s%n",
                                new Date(record.getMillis()),
                                record.getLevel(),
                                record.getLoggerName(),
                                record.getMessage());
                    }
                });
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(level);
    }
}
