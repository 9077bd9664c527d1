package com.hdrmerge.logging;

import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Shared logger for batch runs. Worker threads log through the same instance, so every line
 * carries the thread name to keep interleaved bracket output readable.
 */
public final class AppLogger {
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    /**
     * Switches the console between INFO and FINE output. FINE includes command lines and file lists.
     */
    public static void setVerbose(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.INFO;
        LOGGER.setLevel(level);
        for (Handler handler : LOGGER.getHandlers()) {
            if (handler instanceof StreamHandler) {
                handler.setLevel(level);
            }
        }
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.hdrmerge.HdrMergeBatch");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s [%s] %s%n".formatted(
                    record.getLevel().getName(),
                    Thread.currentThread().getName(),
                    formatMessage(record));
                if (record.getThrown() == null) {
                    return line;
                }
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                return line + trace;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 is not supported", e);
        }
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Central logging disabled: " + ex.getMessage());
        } catch (Exception ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }
}
