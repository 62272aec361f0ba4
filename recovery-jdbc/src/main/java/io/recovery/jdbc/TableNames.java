package io.recovery.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Default table names and validation for identifiers spliced into SQL.
 */
public final class TableNames {
    public static final String DEFAULT_LOCK_TABLE = "distributed_locks";
    public static final String DEFAULT_OUTBOX_TABLE = "outbox";
    public static final String DEFAULT_REPLAY_LOG_TABLE = "replay_log";
    public static final String DEFAULT_ARCHIVE_TABLE = "dead_letter_archive";

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private TableNames() {
    }

    /**
     * Returns {@code tableName} if it is a plain SQL identifier.
     *
     * @throws IllegalArgumentException if the name could alter the statement
     */
    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
