package io.recovery.jdbc.ledger;

import io.recovery.jdbc.JdbcTemplate;
import io.recovery.jdbc.TableNames;
import io.recovery.model.DeadLetterArchiveRecord;
import io.recovery.spi.DeadLetterArchiveStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Dead-letter archive keyed by a unique {@code dl_msg_id}.
 *
 * <p>The upsert is an {@code UPDATE} of {@code archived_at} followed, when no row
 * matched, by an {@code INSERT}. An insert that loses a race to a concurrent
 * archiver falls back to the update, so both calls succeed.
 */
public final class JdbcDeadLetterArchiveStore implements DeadLetterArchiveStore {

    private static final String COLUMNS = "dl_msg_id, original_msg_id, candidate_id, payload, reason, " +
            "dead_lettered_at, archived_by";

    private static final JdbcTemplate.RowMapper<DeadLetterArchiveRecord> ROW_MAPPER =
            rs -> new DeadLetterArchiveRecord(
                    rs.getString("dl_msg_id"),
                    rs.getString("original_msg_id"),
                    rs.getString("candidate_id"),
                    rs.getString("payload"),
                    rs.getString("reason"),
                    JdbcTemplate.instant(rs, "dead_lettered_at"),
                    rs.getString("archived_by"));

    private final String tableName;

    public JdbcDeadLetterArchiveStore() {
        this(TableNames.DEFAULT_ARCHIVE_TABLE);
    }

    public JdbcDeadLetterArchiveStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    @Override
    public void upsert(Connection conn, DeadLetterArchiveRecord record, Instant archivedAt) {
        if (refresh(conn, record, archivedAt) > 0) {
            return;
        }
        String insert = "INSERT INTO " + tableName + " (" + COLUMNS + ", archived_at) VALUES (?,?,?,?,?,?,?,?)";
        boolean inserted = JdbcTemplate.insertIfAbsent(conn, insert,
                record.dlMsgId(), record.originalMsgId(), record.candidateId(), record.payload(),
                record.reason(), record.deadLetteredAt(), record.archivedBy(), archivedAt);
        if (!inserted) {
            refresh(conn, record, archivedAt);
        }
    }

    @Override
    public Optional<DeadLetterArchiveRecord> find(Connection conn, String dlMsgId) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE dl_msg_id=?";
        return JdbcTemplate.query(conn, sql, ROW_MAPPER, dlMsgId).stream().findFirst();
    }

    /** Reads the archive timestamp of a row, mainly for operators and tests. */
    public Optional<Instant> archivedAt(Connection conn, String dlMsgId) {
        String sql = "SELECT archived_at FROM " + tableName + " WHERE dl_msg_id=?";
        return JdbcTemplate.query(conn, sql, rs -> JdbcTemplate.instant(rs, "archived_at"), dlMsgId)
                .stream().findFirst();
    }

    private int refresh(Connection conn, DeadLetterArchiveRecord record, Instant archivedAt) {
        String sql = "UPDATE " + tableName + " SET archived_at=?, archived_by=? WHERE dl_msg_id=?";
        return JdbcTemplate.update(conn, sql, archivedAt, record.archivedBy(), record.dlMsgId());
    }
}
