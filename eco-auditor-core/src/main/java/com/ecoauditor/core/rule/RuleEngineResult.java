package com.ecoauditor.core.rule;

import com.ecoauditor.core.model.Finding;

import java.util.List;

/**
 * Outcome of running the selected rules.
 *
 * @param results rule results in execution order
 * @param complete false when the run was cancelled or a rule reported itself incomplete
 */
public record RuleEngineResult(List<RuleResult> results, boolean complete) {

    public RuleEngineResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Returns the findings of all rules, in execution order.
     *
     * @return all findings
     */
    public List<Finding> findings() {
        return results.stream()
            .flatMap(result -> result.findings().stream())
            .toList();
    }

    public List<String> executedRules() {
        return results.stream().map(RuleResult::ruleId).toList();
    }
}
