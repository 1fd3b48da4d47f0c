package com.flagship.billing_eligibility.summary;

import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Savepoint;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store for summary rows. Like snapshot lines, summary rows are
 * never updated or deleted once written.
 */
@Repository
public class SnapshotSummaryStore {

    private static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;

    public SnapshotSummaryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends summaries under a savepoint of the caller's transaction. On
     * failure only these rows roll back and the transaction stays usable.
     * Not proxied as {@code @Transactional}: an exception crossing a
     * participating boundary would mark the whole commit rollback-only.
     */
    public void appendUnderSavepoint(List<SnapshotSummary> summaries) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Summaries must be appended inside the commit transaction");
        }
        jdbcTemplate.execute((ConnectionCallback<Void>) con -> {
            Savepoint savepoint = con.setSavepoint();
            try {
                append(summaries);
            } catch (RuntimeException e) {
                con.rollback(savepoint);
                throw e;
            }
            con.releaseSavepoint(savepoint);
            return null;
        });
    }

    public void append(List<SnapshotSummary> summaries) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO snapshot_summaries (snapshot_id, scope_package_id, total_count, ready_count, " +
            "blocked_count, invoiced_count, paid_count, ready_rate, as_of_ts, rule_version) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            summaries,
            BATCH_SIZE,
            (ps, s) -> {
                ps.setObject(1, s.getSnapshotId());
                ps.setString(2, s.getScopePackageId());
                ps.setInt(3, s.getTotalCount());
                ps.setInt(4, s.getReadyCount());
                ps.setInt(5, s.getBlockedCount());
                ps.setInt(6, s.getInvoicedCount());
                ps.setInt(7, s.getPaidCount());
                ps.setBigDecimal(8, s.getReadyRate());
                ps.setTimestamp(9, Timestamp.from(s.getAsOfTs()));
                ps.setString(10, s.getRuleVersion());
            }
        );
    }

    public List<SnapshotSummary> findBySnapshotId(UUID snapshotId) {
        return jdbcTemplate.query(
            "SELECT snapshot_id, scope_package_id, total_count, ready_count, blocked_count, invoiced_count, " +
            "paid_count, ready_rate, as_of_ts, rule_version FROM snapshot_summaries " +
            "WHERE snapshot_id = ? ORDER BY scope_package_id",
            (rs, rowNum) -> new SnapshotSummary(
                rs.getObject("snapshot_id", UUID.class),
                rs.getString("scope_package_id"),
                rs.getInt("total_count"),
                rs.getInt("ready_count"),
                rs.getInt("blocked_count"),
                rs.getInt("invoiced_count"),
                rs.getInt("paid_count"),
                rs.getBigDecimal("ready_rate"),
                rs.getTimestamp("as_of_ts").toInstant(),
                rs.getString("rule_version")
            ),
            snapshotId
        );
    }

    public boolean exists(UUID snapshotId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM snapshot_summaries WHERE snapshot_id = ?)",
            Boolean.class,
            snapshotId
        );
        return Boolean.TRUE.equals(exists);
    }
}
