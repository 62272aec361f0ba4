package io.recovery.jdbc.ledger;

import io.recovery.jdbc.JdbcTemplate;
import io.recovery.jdbc.TableNames;
import io.recovery.model.ReplayLogRecord;
import io.recovery.spi.ReplayLogStore;

import java.sql.Connection;
import java.util.Optional;

/**
 * Replay ledger on a table with a unique {@code original_msg_id}.
 *
 * <p>The unique key is the compare-and-insert primitive: of two concurrent inserts
 * for the same original message, the database accepts exactly one. Plain SQL, so
 * one implementation serves H2 and PostgreSQL.
 */
public final class JdbcReplayLogStore implements ReplayLogStore {

    private static final String COLUMNS = "original_msg_id, dl_msg_id, candidate_id, idempotency_key, " +
            "new_msg_id, replayed_by, replayed_at, status";

    private static final JdbcTemplate.RowMapper<ReplayLogRecord> ROW_MAPPER = rs -> new ReplayLogRecord(
            rs.getString("original_msg_id"),
            rs.getString("dl_msg_id"),
            rs.getString("candidate_id"),
            rs.getString("idempotency_key"),
            rs.getString("new_msg_id"),
            rs.getString("replayed_by"),
            JdbcTemplate.instant(rs, "replayed_at"),
            rs.getString("status"));

    private final String tableName;

    public JdbcReplayLogStore() {
        this(TableNames.DEFAULT_REPLAY_LOG_TABLE);
    }

    public JdbcReplayLogStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    @Override
    public Optional<ReplayLogRecord> findByOriginalMsgId(Connection conn, String originalMsgId) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE original_msg_id=?";
        return JdbcTemplate.query(conn, sql, ROW_MAPPER, originalMsgId).stream().findFirst();
    }

    @Override
    public boolean insertIfAbsent(Connection conn, ReplayLogRecord record) {
        String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)";
        return JdbcTemplate.insertIfAbsent(conn, sql,
                record.originalMsgId(), record.dlMsgId(), record.candidateId(), record.idempotencyKey(),
                record.newMsgId(), record.replayedBy(), record.replayedAt(), record.status());
    }

    @Override
    public int recordNewMsgId(Connection conn, String originalMsgId, String newMsgId) {
        String sql = "UPDATE " + tableName + " SET new_msg_id=? WHERE original_msg_id=? AND new_msg_id IS NULL";
        return JdbcTemplate.update(conn, sql, newMsgId, originalMsgId);
    }

    @Override
    public int deleteUnfinished(Connection conn, String originalMsgId) {
        String sql = "DELETE FROM " + tableName +
                " WHERE original_msg_id=? AND new_msg_id IS NULL AND status=?";
        return JdbcTemplate.update(conn, sql, originalMsgId, ReplayLogRecord.STATUS_REPLAYED);
    }
}
