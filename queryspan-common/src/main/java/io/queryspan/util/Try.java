package io.queryspan.util;

import org.slf4j.Logger;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;

/**
 * Best-effort execution of cleanup work. Failures are logged, never rethrown, so use it only
 * where the outcome of the call must not change the outcome of the caller, e.g. closing a
 * session after its result was already taken.
 */
public class Try {

    public static void on(F0 f, Logger logger, String... msg) {
        try {
            f.f();
        } catch (Throwable t) {
            logError(logger, t, msg);
        }
    }

    private static void logError(Logger logger, Throwable t, String... msg) {
        if (logger == null) {
            return;
        }
        String logStr = msg.length > 0 ? msg[0] : "";
        if (isDebugLog(t)) {
            logger.debug(logStr, t);
        } else {
            logger.warn(logStr, t);
        }
    }

    private static boolean isDebugLog(Throwable t) {
        // Those exceptions are normal case when a worker is shut down.
        return t instanceof InterruptedIOException
                || t instanceof ClosedByInterruptException
                || t instanceof InterruptedException;
    }

    @FunctionalInterface
    public static interface F0 {
        void f() throws Throwable;
    }
}
