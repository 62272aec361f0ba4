package io.recovery.dead;

/**
 * Outcome of one archive-and-trim pass.
 *
 * @param archived entries copied to cold storage
 * @param trimmed  entries deleted from the dead-letter stream
 * @param errors   entries that could not be archived or deleted and remain in the stream
 */
public record ArchiveResult(int archived, int trimmed, int errors) {

    public static final ArchiveResult EMPTY = new ArchiveResult(0, 0, 0);
}
