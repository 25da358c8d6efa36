package com.tyron.nanoedit.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
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
 * Controls java.util.logging output via system property:
 * - nanoedit.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 *
 * FINE shows undo/redo and eviction, FINER additionally every group opened and finalized.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "nanoedit.test.logLevel";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY, "INFO"));
        Formatter formatter = new CompactTestLogFormatter();

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(formatter);
            }
        }

        root.log(Level.FINE, "testLogging configured level=" + level.getName());
    }

    static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return Level.parse(v);
        } catch (IllegalArgumentException ignored) {
            return Level.INFO;
        }
    }

    private static final class CompactTestLogFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
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

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
