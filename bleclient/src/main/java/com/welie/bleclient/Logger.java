package com.welie.bleclient;

import org.slf4j.LoggerFactory;

/**
 * Static logging facade used throughout the library. Every call names the tag of the
 * calling class; the tag becomes the SLF4J logger name.
 */
final class Logger {

    static volatile boolean enabled = true;

    private Logger() {
    }

    /** Log a verbose message with optional format args. */
    public static void v(String tag, String msg, Object... args) {
        final org.slf4j.Logger logger = LoggerFactory.getLogger(tag);
        if (enabled && logger.isTraceEnabled()) {
            logger.trace(format(msg, args));
        }
    }

    /**
     * Send a debug log message.
     *
     * @param tag  Used to identify the source of a log message. It usually identifies
     *             the class where the log call occurs.
     * @param msg  The message you would like logged, a {@link String#format} pattern.
     * @param args Arguments for the pattern.
     */
    public static void d(String tag, String msg, Object... args) {
        final org.slf4j.Logger logger = LoggerFactory.getLogger(tag);
        if (enabled && logger.isDebugEnabled()) {
            logger.debug(format(msg, args));
        }
    }

    /** Log an info message with optional format args. */
    public static void i(String tag, String msg, Object... args) {
        final org.slf4j.Logger logger = LoggerFactory.getLogger(tag);
        if (enabled && logger.isInfoEnabled()) {
            logger.info(format(msg, args));
        }
    }

    /** Log a warn message with optional format args. */
    public static void w(String tag, String msg, Object... args) {
        final org.slf4j.Logger logger = LoggerFactory.getLogger(tag);
        if (enabled && logger.isWarnEnabled()) {
            logger.warn(format(msg, args));
        }
    }

    /** Log an error message with optional format args. */
    public static void e(String tag, String msg, Object... args) {
        final org.slf4j.Logger logger = LoggerFactory.getLogger(tag);
        if (enabled && logger.isErrorEnabled()) {
            logger.error(format(msg, args));
        }
    }

    /**
     * Log an error message together with the throwable that caused it.
     *
     * @param tag       Used to identify the source of a log message.
     * @param throwable The exception to log, including its stack trace.
     * @param msg       The message you would like logged.
     * @param args      Arguments for the pattern.
     */
    public static void e(String tag, Throwable throwable, String msg, Object... args) {
        final org.slf4j.Logger logger = LoggerFactory.getLogger(tag);
        if (enabled && logger.isErrorEnabled()) {
            logger.error(format(msg, args), throwable);
        }
    }

    private static String format(String msg, Object... args) {
        return args.length == 0 ? msg : String.format(msg, args);
    }
}
