package com.flagship.billing_eligibility.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One row per environment naming the current snapshot.
 *
 * The pointer only moves forward in as-of: a publish for an earlier as-of
 * than the one already current commits its lines but leaves the pointer
 * alone. The comparison happens inside the UPDATE so concurrent commits
 * for different as-of values serialize on the row lock.
 */
@Repository
@Slf4j
public class CurrentPointerStore {

    private final JdbcTemplate jdbcTemplate;

    public CurrentPointerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Points the environment at a snapshot if its as-of is not older than the current one.
     *
     * @return true if the pointer now names the snapshot
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean advance(String environment, UUID snapshotId, Instant asOfTs, Instant now) {
        jdbcTemplate.update(
            "INSERT INTO current_pointers (environment, snapshot_id, as_of_ts, version, updated_at) " +
            "VALUES (?, NULL, NULL, 0, ?) ON CONFLICT (environment) DO NOTHING",
            environment,
            Timestamp.from(now)
        );

        int updated = jdbcTemplate.update(
            "UPDATE current_pointers SET snapshot_id = ?, as_of_ts = ?, version = version + 1, updated_at = ? " +
            "WHERE environment = ? AND (as_of_ts IS NULL OR as_of_ts <= ?)",
            snapshotId,
            Timestamp.from(asOfTs),
            Timestamp.from(now),
            environment,
            Timestamp.from(asOfTs)
        );

        if (updated == 0) {
            log.info("Current pointer kept: environment={}, snapshotId={} has older asOfTs={}",
                    environment, snapshotId, asOfTs);
            return false;
        }
        return true;
    }

    public Optional<CurrentPointer> find(String environment) {
        List<CurrentPointer> rows = jdbcTemplate.query(
            "SELECT environment, snapshot_id, as_of_ts, version, updated_at FROM current_pointers " +
            "WHERE environment = ? AND snapshot_id IS NOT NULL",
            (rs, rowNum) -> new CurrentPointer(
                rs.getString("environment"),
                rs.getObject("snapshot_id", UUID.class),
                rs.getTimestamp("as_of_ts").toInstant(),
                rs.getLong("version"),
                rs.getTimestamp("updated_at").toInstant()
            ),
            environment
        );
        return rows.stream().findFirst();
    }
}
