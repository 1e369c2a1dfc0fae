package org.hci.contrast;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a piece of work and logs how long it took.
 *
 * @author hci
 */
public final class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    /**
     * Execute the callable, logging the elapsed time. The message is a
     * format string whose last argument is the time in milliseconds.
     * Exceptions thrown by the callable are rethrown unchanged.
     */
    public static <T> T execute(Callable<T> callable, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, callable, message, args);
    }

    public static <T> T execute(Level logLevel, Callable<T> callable, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return callable.call();
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            if (LOG.isLoggable(logLevel)) {
                Object[] all = new Object[args.length + 1];
                System.arraycopy(args, 0, all, 0, args.length);
                all[args.length] = elapsed;
                LOG.log(logLevel, String.format(message, all));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }
}
