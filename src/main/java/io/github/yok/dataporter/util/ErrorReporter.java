package io.github.yok.dataporter.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal command failures and returns the process exit status to use.
 *
 * <p>
 * Every DataPorter command is a one-shot batch run. When a command cannot continue (unreadable
 * input, unreachable database, invalid option combination), the failure is logged with its stack
 * trace and a concise {@code ERROR:} line is written to {@code System.err}. The caller ends the
 * process with the returned status.
 * </p>
 *
 * <p>
 * Tests can switch the current thread to "throw instead of report" mode so that a fatal path
 * surfaces as an {@link IllegalStateException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorReporter {

    /**
     * Exit status returned for every fatal failure.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> THROW_ENABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorReporter() {
        // Utility class; do not instantiate.
    }

    /**
     * Makes {@link #fatal} throw {@link IllegalStateException} on the current thread.
     */
    public static void throwOnFatalForCurrentThread() {
        THROW_ENABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreForCurrentThread() {
        THROW_ENABLED.remove();
    }

    /**
     * Logs the message with the full stack trace of {@code cause} and prints a short message to
     * {@code System.err}.
     *
     * @param message description of what failed
     * @param cause root cause
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static int fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
        return EXIT_FAILURE;
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message description of what failed
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static int fatal(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        return EXIT_FAILURE;
    }
}
