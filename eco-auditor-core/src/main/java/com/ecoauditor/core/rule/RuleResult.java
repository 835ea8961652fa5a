package com.ecoauditor.core.rule;

import com.ecoauditor.core.model.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Result returned by a rule after evaluation.
 *
 * @param ruleId ID of the rule that produced this result
 * @param findings findings, in any order
 * @param complete false when the rule was cut short by cancellation
 */
public record RuleResult(String ruleId, List<Finding> findings, boolean complete) {

    public RuleResult {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static RuleResult of(String ruleId, List<Finding> findings) {
        return new RuleResult(ruleId, findings, true);
    }

    public static RuleResult empty(String ruleId) {
        return new RuleResult(ruleId, List.of(), true);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
