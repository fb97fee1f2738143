package io.github.yok.crmexport.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal error of the export run.
 *
 * <p>
 * The error is logged with its stack trace and a concise message is written to
 * {@code System.err}. The JVM is not terminated here; {@code Main} returns normally after
 * reporting. Tests can switch the current thread to throwing {@link IllegalStateException}
 * instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Makes {@code errorAndExit} throw on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and cause and prints a concise message to {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
