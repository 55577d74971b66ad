package com.tyron.syntaxdiag.testFramework;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging for the {@code com.tyron.syntaxdiag} loggers.
 * <p>
 * {@code -Dsyntaxdiag.test.logLevel=FINE} prints one line per diagnostics run plus every emitted and superseded
 * diagnostic. The default level only lets warnings such as a nesting overflow through, unless a run was created
 * with {@code syntaxdiag.diagnostics.logEmissions}, which promotes the emission records to INFO.
 * <p>
 * {@link #capture(Class, Level)} collects the records of one logger so a test can assert on them.
 */
public final class TestLogging {

    public static final String LOG_LEVEL_PROPERTY = "syntaxdiag.test.logLevel";
    public static final String LOGGER_NAMESPACE = "com.tyron.syntaxdiag";

    // held so the configured level is not lost when the logger is collected
    private static final Logger NAMESPACE_LOGGER = Logger.getLogger(LOGGER_NAMESPACE);

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LOG_LEVEL_PROPERTY, "INFO"));
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new DiagnosticsLogFormatter());

        NAMESPACE_LOGGER.setLevel(level);
        NAMESPACE_LOGGER.setUseParentHandlers(false);
        NAMESPACE_LOGGER.addHandler(console);
        NAMESPACE_LOGGER.log(Level.CONFIG, "test logging configured level=" + level.getName());
    }

    /**
     * Starts collecting the records {@code owner}'s logger publishes at {@code level} or above. The logger's own
     * level is lowered to {@code level} until the capture is closed.
     */
    @NotNull
    public static CapturedLog capture(@NotNull Class<?> owner, @NotNull Level level) {
        return new CapturedLog(Logger.getLogger(owner.getName()), level);
    }

    static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    public static final class CapturedLog implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = new CopyOnWriteArrayList<>();
        private final Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (isLoggable(record)) {
                    records.add(record);
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        private CapturedLog(Logger logger, Level level) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            handler.setLevel(level);
            logger.setLevel(level);
            logger.addHandler(handler);
        }

        @NotNull
        public List<LogRecord> getRecords() {
            return List.copyOf(records);
        }

        /**
         * The messages of the captured records that start with {@code prefix}, e.g. {@code "Diagnostic emitted"}.
         */
        @NotNull
        public List<String> messagesStartingWith(@NotNull String prefix) {
            List<String> out = new ArrayList<>();
            for (LogRecord record : records) {
                if (record.getMessage().startsWith(prefix)) {
                    out.add(record.getMessage());
                }
            }
            return out;
        }

        @Override
        public void close() {
            logger.removeHandler(handler);
            logger.setLevel(previousLevel);
        }
    }

    /**
     * {@code FINE    DiagnosticCollector: Diagnostic emitted: id=...}, one line per record.
     */
    static final class DiagnosticsLogFormatter extends Formatter {

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(96)
                    .append(String.format(Locale.ROOT, "%-7s ", record.getLevel().getName()))
                    .append(simpleName(record.getLoggerName())).append(": ")
                    .append(formatMessage(record))
                    .append('\n');
            Throwable thrown = record.getThrown();
            if (thrown != null) {
                out.append("  ").append(thrown).append('\n');
            }
            return out.toString();
        }

        static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isEmpty()) return LOGGER_NAMESPACE;
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
