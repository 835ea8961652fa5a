package com.ecoauditor.core.report.impl;

import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Severity;
import com.ecoauditor.core.report.AuditReport;
import com.ecoauditor.core.report.ReportFormatter;

import java.util.List;

/**
 * Human-readable report grouped by severity.
 *
 * <p><b>Example output:</b>
 * <pre>
 * Ecosystem audit: FAIL
 * 1 blocking, 1 warning, 0 info
 *
 * BLOCKING (1)
 *   [metadata] mirror-gate: Missing required field: license
 *       fix: Add a 'license' entry to the descriptor
 *
 * WARNING (1)
 *   [staleness] index: Published total_repos is 12 but the index lists 11 repositories
 *       fix: Regenerate the index statistics
 * </pre>
 */
public class TextReportFormatter implements ReportFormatter {

    private static final String INCOMPLETE_MARKER = "INCOMPLETE";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String format(AuditReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Ecosystem audit: ").append(report.status());
        if (!report.complete()) {
            sb.append(" (").append(INCOMPLETE_MARKER).append(": run was interrupted, results are partial)");
        }
        sb.append('\n');
        sb.append(report.count(Severity.BLOCKING)).append(" blocking, ")
            .append(report.count(Severity.WARNING)).append(report.count(Severity.WARNING) == 1 ? " warning, " : " warnings, ")
            .append(report.count(Severity.INFO)).append(" info\n");

        for (Severity severity : Severity.values()) {
            List<Finding> findings = report.findings(severity);
            if (findings.isEmpty()) {
                continue;
            }
            sb.append('\n').append(severity.name()).append(" (").append(findings.size()).append(")\n");
            for (Finding finding : findings) {
                appendFinding(sb, finding);
            }
        }

        if (report.findings().isEmpty()) {
            sb.append("\nNo findings.\n");
        }
        return sb.toString();
    }

    private void appendFinding(StringBuilder sb, Finding finding) {
        sb.append("  [").append(finding.category().wireName()).append("] ")
            .append(finding.subject()).append(": ").append(finding.message()).append('\n');
        finding.remediationHint().ifPresent(hint -> sb.append("      fix: ").append(hint).append('\n'));
    }
}
