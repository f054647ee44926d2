package io.github.yok.sqlmodelrunner.util;

import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.exception.GraphException;
import io.github.yok.sqlmodelrunner.exception.ModelParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports errors that end a run before or outside model execution.
 *
 * <p>
 * The error is logged through SLF4J and a concise message is written to {@code System.err}. The
 * process is not terminated here; {@code Main} turns the failure into exit code 1.
 * </p>
 *
 * <p>
 * Configuration, model file and graph errors are logged without a stack trace. Any other error
 * keeps its stack trace in the log.
 * </p>
 *
 * <p>
 * Tests can make {@link #fatal(String, Throwable)} throw instead of printing via
 * {@link #disableExitForCurrentThread()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs a fatal error and prints a concise message to {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void fatal(String message, Throwable cause) {
        if (isUserError(cause)) {
            log.error("{}: {}", message, cause.getMessage());
        } else {
            log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        }
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + cause.getMessage());
    }

    /**
     * Logs a fatal error without a cause and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void fatal(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    private static boolean isUserError(Throwable cause) {
        return cause instanceof ConfigurationException || cause instanceof ModelParseException
                || cause instanceof GraphException;
    }
}
