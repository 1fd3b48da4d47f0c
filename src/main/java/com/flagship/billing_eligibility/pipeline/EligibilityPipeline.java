package com.flagship.billing_eligibility.pipeline;

import com.flagship.billing_eligibility.billing.BillingReconciler;
import com.flagship.billing_eligibility.billing.BillingReconciliation;
import com.flagship.billing_eligibility.billing.BillingStatus;
import com.flagship.billing_eligibility.evidence.EvidenceProfile;
import com.flagship.billing_eligibility.evidence.EvidenceReconciler;
import com.flagship.billing_eligibility.evidence.EvidenceReconciliation;
import com.flagship.billing_eligibility.grain.GrainResolver;
import com.flagship.billing_eligibility.grain.SpineRow;
import com.flagship.billing_eligibility.input.EligibilityInputs;
import com.flagship.billing_eligibility.quality.CycleWarning;
import com.flagship.billing_eligibility.rules.EligibilityRule;
import com.flagship.billing_eligibility.rules.RuleInput;
import com.flagship.billing_eligibility.rules.RuleOutcome;
import com.flagship.billing_eligibility.rules.RuleRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes a draft snapshot from conformed inputs.
 *
 * Grain Resolver -> Evidence Reconciler -> Billing Reconciler -> Rule Engine.
 *
 * This is a pure function of (inputs, as-of, rule version): it writes
 * nothing and reads no clock, so the same arguments always produce the same
 * lines in the same order. The rule version is resolved first so an unknown
 * version fails before any reconciliation work.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EligibilityPipeline {

    private final GrainResolver grainResolver;
    private final EvidenceReconciler evidenceReconciler;
    private final BillingReconciler billingReconciler;
    private final RuleRegistry ruleRegistry;

    public DraftSnapshot compute(EligibilityInputs inputs, Instant asOf, String ruleVersion) {
        EligibilityRule rule = ruleRegistry.resolve(ruleVersion);

        List<SpineRow> spine = grainResolver.resolve(
                inputs.getPackages(), inputs.getLines(), inputs.getIntervals(), asOf);

        EvidenceReconciliation evidence = evidenceReconciler.reconcile(spine, inputs.getEvidenceAggregates(), asOf);
        BillingReconciliation billing = billingReconciler.reconcile(
                spine, inputs.getInvoices(), inputs.getReversals(), asOf);

        List<EligibilityLine> lines = new ArrayList<>(spine.size());
        for (SpineRow row : spine) {
            EvidenceProfile profile = evidence.profileFor(row.getKey());
            BillingStatus billingStatus = billing.statusFor(row.getKey());
            RuleOutcome outcome = rule.evaluate(new RuleInput(profile, row.getAssignmentStatus(), billingStatus));
            lines.add(new EligibilityLine(
                    row.getKey(),
                    row.getAssignmentStatus(),
                    outcome.isReadyToInvoice(),
                    billingStatus.isInvoiced(),
                    billingStatus.isPaid(),
                    outcome.getBlockerCodes()
            ));
        }

        List<CycleWarning> warnings = new ArrayList<>(evidence.getWarnings());
        warnings.addAll(billing.getWarnings());

        DraftSnapshot draft = new DraftSnapshot(asOf, rule.version(), List.copyOf(lines), List.copyOf(warnings),
                billing.getOrphans(), evidence.getUnmatched());

        log.info("Draft computed: lines={}, ready={}, warnings={}, orphanInvoiceLines={}, ruleVersion={}",
                lines.size(), draft.readyCount(), warnings.size(), billing.getOrphans().size(), rule.version());
        return draft;
    }
}
