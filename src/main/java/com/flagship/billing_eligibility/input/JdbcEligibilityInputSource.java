package com.flagship.billing_eligibility.input;

import com.flagship.billing_eligibility.billing.InvoiceLineFact;
import com.flagship.billing_eligibility.billing.InvoiceReversal;
import com.flagship.billing_eligibility.evidence.EvidenceAggregate;
import com.flagship.billing_eligibility.evidence.EvidenceType;
import com.flagship.billing_eligibility.grain.AssignmentInterval;
import com.flagship.billing_eligibility.grain.PackageLine;
import com.flagship.billing_eligibility.grain.ScopePackage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Reads the conformed relations that ingestion writes into the shared schema.
 *
 * All queries run in one read-only transaction so the cycle sees one
 * consistent view. Package lines and invoice lines are filtered to what
 * existed at as-of; intervals, evidence and reversals are returned whole
 * because the reconcilers reason about their timestamps themselves.
 */
@Service
@Slf4j
public class JdbcEligibilityInputSource implements EligibilityInputSource {

    private final JdbcTemplate jdbcTemplate;

    public JdbcEligibilityInputSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public EligibilityInputs load(Instant asOf) {
        Timestamp asOfTs = Timestamp.from(asOf);

        List<ScopePackage> packages = jdbcTemplate.query(
            "SELECT scope_package_id, vendor, status, upload_version FROM scope_packages " +
            "WHERE uploaded_at <= ? ORDER BY scope_package_id, upload_version",
            (rs, rowNum) -> new ScopePackage(
                rs.getString("scope_package_id"),
                rs.getString("vendor"),
                rs.getString("status"),
                rs.getInt("upload_version")
            ),
            asOfTs
        );

        List<PackageLine> lines = jdbcTemplate.query(
            "SELECT scope_package_id, floc_id, upload_version FROM package_lines " +
            "WHERE uploaded_at <= ? ORDER BY scope_package_id, upload_version, floc_id",
            (rs, rowNum) -> new PackageLine(
                rs.getString("scope_package_id"),
                rs.getString("floc_id"),
                rs.getInt("upload_version")
            ),
            asOfTs
        );

        List<AssignmentInterval> intervals = jdbcTemplate.query(
            "SELECT floc_id, scope_package_id, effective_start_ts, effective_end_ts " +
            "FROM assignment_intervals ORDER BY floc_id, effective_start_ts",
            (rs, rowNum) -> new AssignmentInterval(
                rs.getString("floc_id"),
                rs.getString("scope_package_id"),
                instant(rs, "effective_start_ts"),
                instant(rs, "effective_end_ts")
            )
        );

        List<EvidenceAggregate> evidence = jdbcTemplate.query(
            "SELECT scope_package_id, floc_id, evidence_type, received_flg, evidence_ts, evidence_count " +
            "FROM evidence_aggregates ORDER BY evidence_type, scope_package_id, floc_id",
            (rs, rowNum) -> new EvidenceAggregate(
                rs.getString("scope_package_id"),
                rs.getString("floc_id"),
                EvidenceType.valueOf(rs.getString("evidence_type")),
                rs.getBoolean("received_flg"),
                instant(rs, "evidence_ts"),
                rs.getInt("evidence_count")
            )
        );

        List<InvoiceLineFact> invoices = jdbcTemplate.query(
            "SELECT invoice_id, scope_package_id, floc_id, invoiced_ts, paid_ts FROM invoice_line_facts " +
            "WHERE invoiced_ts <= ? ORDER BY invoice_id, scope_package_id, floc_id",
            (rs, rowNum) -> new InvoiceLineFact(
                rs.getString("invoice_id"),
                rs.getString("scope_package_id"),
                rs.getString("floc_id"),
                instant(rs, "invoiced_ts"),
                instant(rs, "paid_ts")
            ),
            asOfTs
        );

        List<InvoiceReversal> reversals = jdbcTemplate.query(
            "SELECT invoice_id, scope_package_id, floc_id, reversed_ts, reason FROM invoice_reversals " +
            "ORDER BY invoice_id, reversed_ts",
            (rs, rowNum) -> new InvoiceReversal(
                rs.getString("invoice_id"),
                rs.getString("scope_package_id"),
                rs.getString("floc_id"),
                instant(rs, "reversed_ts"),
                rs.getString("reason")
            )
        );

        log.debug("Loaded inputs: packages={}, lines={}, intervals={}, evidence={}, invoices={}, reversals={}, asOf={}",
                packages.size(), lines.size(), intervals.size(), evidence.size(),
                invoices.size(), reversals.size(), asOf);

        return EligibilityInputs.builder()
                .packages(packages)
                .lines(lines)
                .intervals(intervals)
                .evidenceAggregates(evidence)
                .invoices(invoices)
                .reversals(reversals)
                .build();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
