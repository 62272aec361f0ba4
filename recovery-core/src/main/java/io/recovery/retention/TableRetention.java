package io.recovery.retention;

/**
 * Retention outcome for one table.
 *
 * @param candidates rows past their retention window when the pass started
 * @param deleted    rows actually deleted, always {@code 0} in a dry run
 */
public record TableRetention(long candidates, long deleted) {
}
