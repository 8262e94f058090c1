package com.tyron.gamedit.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Routes the editor's {@code com.tyron.gamedit} loggers to a console handler of their own.
 * The level comes from the {@value #LEVEL_PROPERTY} system property (default WARNING, so
 * passing tests stay quiet).
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "gamedit.test.logLevel";

    private static final Logger GAMEDIT = Logger.getLogger("com.tyron.gamedit");

    private static Handler handler;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (handler != null) {
            return;
        }
        Level level;
        try {
            level = Level.parse(System.getProperty(LEVEL_PROPERTY, "WARNING").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            level = Level.WARNING;
        }

        handler = new ConsoleHandler();
        handler.setLevel(level);
        handler.setFormatter(new LaneFormatter());
        GAMEDIT.setLevel(level);
        GAMEDIT.setUseParentHandlers(false);
        GAMEDIT.addHandler(handler);
    }

    /**
     * One line per record: {@code [thread] LEVEL Class: message}. The thread is either the test
     * thread or a cache lane.
     */
    private static final class LaneFormatter extends Formatter {

        @Override
        public String format(LogRecord record) {
            String logger = record.getLoggerName() == null ? "?" : record.getLoggerName();
            String line = "[" + Thread.currentThread().getName() + "] "
                    + record.getLevel().getName() + " "
                    + logger.substring(logger.lastIndexOf('.') + 1) + ": "
                    + formatMessage(record) + System.lineSeparator();
            if (record.getThrown() == null) {
                return line;
            }
            StringWriter trace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(trace));
            return line + trace;
        }
    }
}
