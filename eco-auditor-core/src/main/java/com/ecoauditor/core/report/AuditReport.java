package com.ecoauditor.core.report;

import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Final, ordered result of an audit run.
 *
 * <p>Findings are sorted by their natural order and exact duplicates are removed, so two runs
 * over identical input produce identical reports regardless of the order in which checks
 * completed.
 *
 * @param findings findings, sorted and unique
 * @param rules ids of the rules that ran, in execution order
 * @param complete false when the run was cancelled before every check finished
 */
public record AuditReport(List<Finding> findings, List<String> rules, boolean complete) {

    public static final String STATUS_PASS = "PASS";
    public static final String STATUS_PASS_WITH_WARNINGS = "PASS WITH WARNINGS";
    public static final String STATUS_FAIL = "FAIL";

    /**
     * Compact constructor sorting and de-duplicating findings.
     */
    public AuditReport {
        findings = findings == null ? List.of() : List.copyOf(new TreeSet<>(findings));
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Returns true when no finding is blocking.
     *
     * @return whether the gate passes
     */
    public boolean passed() {
        return findings.stream().noneMatch(Finding::isBlocking);
    }

    public List<Finding> findings(Severity severity) {
        return findings.stream().filter(finding -> finding.severity() == severity).toList();
    }

    public int count(Severity severity) {
        return (int) findings.stream().filter(finding -> finding.severity() == severity).count();
    }

    /**
     * Returns the number of findings per severity, in severity order, including zero counts.
     *
     * @return counts by severity
     */
    public Map<Severity, Integer> summary() {
        Map<Severity, Integer> summary = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            summary.put(severity, count(severity));
        }
        return summary;
    }

    /**
     * Returns the status line: {@code PASS}, {@code PASS WITH WARNINGS} or {@code FAIL}.
     *
     * @return gate status
     */
    public String status() {
        if (!passed()) {
            return STATUS_FAIL;
        }
        return count(Severity.WARNING) > 0 ? STATUS_PASS_WITH_WARNINGS : STATUS_PASS;
    }

    /**
     * Returns the findings about one subject, in report order.
     *
     * @param subject repository name or other subject
     * @return matching findings
     */
    public List<Finding> findingsFor(String subject) {
        List<Finding> matching = new ArrayList<>();
        for (Finding finding : findings) {
            if (finding.subject().equals(subject)) {
                matching.add(finding);
            }
        }
        return matching;
    }
}
