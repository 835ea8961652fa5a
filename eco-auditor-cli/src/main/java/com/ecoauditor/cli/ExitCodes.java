package com.ecoauditor.cli;

import com.ecoauditor.core.report.AuditReport;

/**
 * Process exit codes of the audit commands.
 */
public final class ExitCodes {

    /** No blocking findings. */
    public static final int PASSED = 0;

    /** At least one blocking finding. */
    public static final int BLOCKING_FINDINGS = 1;

    /** Malformed input, invalid arguments or an unexpected error. Same as picocli's usage code. */
    public static final int ERROR = 2;

    /** The run was interrupted and the report is partial. */
    public static final int INCOMPLETE = 3;

    private ExitCodes() {
        // Utility class
    }

    /**
     * Maps a report to its exit code. An incomplete report takes precedence over the gate
     * result.
     *
     * @param report audit report
     * @return exit code
     */
    public static int of(AuditReport report) {
        if (!report.complete()) {
            return INCOMPLETE;
        }
        return report.passed() ? PASSED : BLOCKING_FINDINGS;
    }
}
