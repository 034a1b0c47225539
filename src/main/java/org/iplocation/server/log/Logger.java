package org.iplocation.server.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Thin facade over a Log4j2 {@link ExtendedLogger} reporting the caller location correctly.
 */
public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public void error(Object message) {
        log(Level.ERROR, message);
    }

    public void error(Object message, Object... params) {
        log(Level.ERROR, message.toString(), params);
    }

    public void error(Object message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    public void warn(Object message) {
        log(Level.WARN, message);
    }

    public void warn(Object message, Object... params) {
        log(Level.WARN, message.toString(), params);
    }

    public void warn(Object message, Throwable t, Object... params) {
        log(Level.WARN, message.toString(), t, params);
    }

    public void info(Object message) {
        log(Level.INFO, message);
    }

    public void info(Object message, Object... params) {
        log(Level.INFO, message.toString(), params);
    }

    public void debug(Object message) {
        log(Level.DEBUG, message);
    }

    public void debug(Object message, Object... params) {
        log(Level.DEBUG, message.toString(), params);
    }

    private void log(Level level, Object message) {
        log(level, message, null);
    }

    private void log(Level level, Object message, Throwable t) {
        delegate.logIfEnabled(FQCN, level, null, message, t);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, message, params);
    }

    private void log(Level level, String message, Throwable t, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, new FormattedMessage(message, params), t);
    }
}
