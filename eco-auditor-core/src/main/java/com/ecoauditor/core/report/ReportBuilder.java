package com.ecoauditor.core.report;

import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.rule.RuleEngineResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collects findings from the loader and the rule engine into an {@link AuditReport}.
 *
 * <p>Not thread-safe; one builder per run.
 */
public class ReportBuilder {

    private final List<Finding> findings = new ArrayList<>();
    private final List<String> rules = new ArrayList<>();
    private boolean complete = true;

    public ReportBuilder addFinding(Finding finding) {
        findings.add(finding);
        return this;
    }

    public ReportBuilder addFindings(Collection<Finding> more) {
        findings.addAll(more);
        return this;
    }

    /**
     * Adds the findings and executed rules of a rule engine run.
     *
     * @param result rule engine result
     * @return this builder
     */
    public ReportBuilder addRuleResults(RuleEngineResult result) {
        findings.addAll(result.findings());
        rules.addAll(result.executedRules());
        if (!result.complete()) {
            complete = false;
        }
        return this;
    }

    public ReportBuilder markIncomplete() {
        complete = false;
        return this;
    }

    public AuditReport build() {
        return new AuditReport(findings, rules, complete);
    }
}
