package org.ultracam.snorm;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging how long each pipeline stage takes.
 *
 * @author ultracam
 */
final class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    /**
     * A unit of work that may fail with a checked exception.
     *
     * @param <T> The result type
     * @param <X> The exception type
     */
    interface Action<T, X extends Exception> {

        T run() throws X;
    }

    static <T, X extends Exception> T execute(Action<T, X> action, String message, Object... args) throws X {
        return execute(DEFAULT_LOG_LEVEL, action, message, args);
    }

    /**
     * Run an action and log the elapsed time whether or not it succeeds.
     *
     * @param logLevel The level to log at
     * @param action The action
     * @param message Format for the log message, the elapsed milliseconds are
     * appended to the arguments
     * @param args The format arguments
     * @return The result of the action
     * @throws X If the action fails
     */
    static <T, X extends Exception> T execute(Level logLevel, Action<T, X> action, String message, Object... args) throws X {
        long start = System.currentTimeMillis();
        try {
            return action.run();
        } finally {
            long stop = System.currentTimeMillis();
            if (LOG.isLoggable(logLevel)) {
                LOG.log(logLevel, String.format(message, append(args, stop - start)));
            }
        }
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }
}
