package com.tyron.nanodoc.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output of the {@code com.tyron.nanodoc} loggers via system property:
 * - nanodoc.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 */
public final class TestLogging {

    public static final String ROOT_LOGGER = "com.tyron.nanodoc";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty("nanodoc.test.logLevel", "INFO"));

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new CompactTestLogFormatter());

        Logger logger = Logger.getLogger(ROOT_LOGGER);
        logger.setLevel(level);
        logger.setUseParentHandlers(false);
        logger.addHandler(console);

        logger.log(Level.CONFIG, "testLogging configured level=" + level.getName());
    }

    /**
     * Records everything logged under {@code loggerName} at {@code level} or above until closed.
     */
    public static Capture capture(String loggerName, Level level) {
        return new Capture(Logger.getLogger(loggerName), level);
    }

    public static final class Capture extends Handler implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = new ArrayList<>();

        private Capture(Logger logger, Level level) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            setLevel(level);
            logger.setLevel(level);
            logger.addHandler(this);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            if (isLoggable(record)) {
                records.add(record);
            }
        }

        public synchronized List<String> messages() {
            List<String> messages = new ArrayList<>(records.size());
            for (LogRecord record : records) {
                messages.add(record.getMessage());
            }
            return messages;
        }

        public synchronized List<LogRecord> records() {
            return new ArrayList<>(records);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(previousLevel);
        }
    }

    private static final class CompactTestLogFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            String loggerName = record.getLoggerName();
            String simple = loggerName == null ? "root" : loggerName.substring(loggerName.lastIndexOf('.') + 1);

            StringBuilder out = new StringBuilder(128)
                    .append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simple).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }
    }

    private static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.INFO;
        }
    }
}
