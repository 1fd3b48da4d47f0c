package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.grain.AssignmentStatus;
import com.flagship.billing_eligibility.rules.BlockerCode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store for snapshot lines.
 *
 * Plain JDBC: lines are inserted once and never updated. The
 * {@code snapshot_lines} table rejects UPDATE and DELETE with a trigger,
 * and its primary key (snapshot_id, scope_package_id, floc_id) makes a
 * duplicate line fail the whole commit.
 */
@Repository
public class SnapshotLineStore {

    static final String BLOCKER_SEPARATOR = ";";

    private static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;

    public SnapshotLineStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends lines inside the caller's commit transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void appendLines(List<SnapshotLine> lines) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO snapshot_lines (snapshot_id, scope_package_id, floc_id, assignment_status, " +
            "ready_to_invoice_flg, invoiced_flg, paid_flg, blocker_codes, as_of_ts, rule_version) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            lines,
            BATCH_SIZE,
            (ps, line) -> {
                ps.setObject(1, line.getSnapshotId());
                ps.setString(2, line.getScopePackageId());
                ps.setString(3, line.getFlocId());
                ps.setString(4, line.getAssignmentStatus().name());
                ps.setBoolean(5, line.isReadyToInvoice());
                ps.setBoolean(6, line.isInvoiced());
                ps.setBoolean(7, line.isPaid());
                ps.setString(8, encodeBlockers(line.getBlockerCodes()));
                ps.setTimestamp(9, Timestamp.from(line.getAsOfTs()));
                ps.setString(10, line.getRuleVersion());
            }
        );
    }

    public List<SnapshotLine> findBySnapshotId(UUID snapshotId) {
        return jdbcTemplate.query(
            "SELECT snapshot_id, scope_package_id, floc_id, assignment_status, ready_to_invoice_flg, " +
            "invoiced_flg, paid_flg, blocker_codes, as_of_ts, rule_version " +
            "FROM snapshot_lines WHERE snapshot_id = ? ORDER BY scope_package_id, floc_id",
            lineRowMapper(),
            snapshotId
        );
    }

    public long countBySnapshotId(UUID snapshotId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM snapshot_lines WHERE snapshot_id = ?",
            Long.class,
            snapshotId
        );
        return count != null ? count : 0L;
    }

    static String encodeBlockers(List<BlockerCode> codes) {
        return String.join(BLOCKER_SEPARATOR, codes.stream().map(BlockerCode::name).toList());
    }

    static List<BlockerCode> decodeBlockers(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(BLOCKER_SEPARATOR))
                .map(BlockerCode::valueOf)
                .toList();
    }

    private RowMapper<SnapshotLine> lineRowMapper() {
        return (rs, rowNum) -> new SnapshotLine(
            rs.getObject("snapshot_id", UUID.class),
            rs.getString("scope_package_id"),
            rs.getString("floc_id"),
            AssignmentStatus.valueOf(rs.getString("assignment_status")),
            rs.getBoolean("ready_to_invoice_flg"),
            rs.getBoolean("invoiced_flg"),
            rs.getBoolean("paid_flg"),
            decodeBlockers(rs.getString("blocker_codes")),
            rs.getTimestamp("as_of_ts").toInstant(),
            rs.getString("rule_version")
        );
    }
}
