package io.recovery.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs non-critical side effects such as metrics updates or secondary tracking.
 *
 * <p>A failing side effect is logged at {@code WARNING} and otherwise ignored; it
 * never changes the outcome of the operation that triggered it. This is the only
 * place where runtime exceptions are deliberately not propagated.
 */
public final class SideEffects {
    private static final Logger logger = Logger.getLogger(SideEffects.class.getName());

    private SideEffects() {
    }

    /**
     * Runs {@code action}, logging and discarding any runtime exception.
     *
     * @param description short label used in the log message
     * @param action      the side effect
     * @return {@code true} if the action completed
     */
    public static boolean bestEffort(String description, Runnable action) {
        try {
            action.run();
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Non-critical side effect failed: " + description, e);
            return false;
        }
    }
}
