package com.ecoauditor.core.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * One audit result.
 *
 * <p>Findings are immutable and totally ordered: severity (blocking first), then category,
 * then subject, then message, then remediation. Reports sort by this order so their
 * content never depends on the order in which checks or probes completed.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Finding finding = Finding.blocking(
 *     Category.METADATA,
 *     "mirror-gate",
 *     "Missing required field: license"
 * ).withRemediation("Add a 'license' entry (SPDX identifier) to the descriptor");
 * }</pre>
 *
 * @param severity how the finding affects the audit gate
 * @param category area of the ecosystem concerned
 * @param subject repository name or URL the finding is about
 * @param message human-readable description
 * @param remediation suggested fix, or null when none is known
 */
public record Finding(
    Severity severity,
    Category category,
    String subject,
    String message,
    String remediation
) implements Comparable<Finding> {

    private static final Comparator<Finding> ORDER = Comparator
        .comparing(Finding::severity)
        .thenComparing(Finding::category)
        .thenComparing(Finding::subject)
        .thenComparing(Finding::message)
        .thenComparing(finding -> finding.remediation() == null ? "" : finding.remediation());

    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (remediation != null && remediation.isBlank()) {
            remediation = null;
        }
    }

    public static Finding blocking(Category category, String subject, String message) {
        return new Finding(Severity.BLOCKING, category, subject, message, null);
    }

    public static Finding warning(Category category, String subject, String message) {
        return new Finding(Severity.WARNING, category, subject, message, null);
    }

    public static Finding info(Category category, String subject, String message) {
        return new Finding(Severity.INFO, category, subject, message, null);
    }

    /**
     * Returns a copy carrying the given remediation suggestion.
     *
     * @param suggestion suggested fix
     * @return new finding
     */
    public Finding withRemediation(String suggestion) {
        return new Finding(severity, category, subject, message, suggestion);
    }

    /**
     * Returns a copy with a different severity.
     *
     * @param newSeverity severity to apply
     * @return new finding
     */
    public Finding withSeverity(Severity newSeverity) {
        return new Finding(newSeverity, category, subject, message, remediation);
    }

    public Optional<String> remediationHint() {
        return Optional.ofNullable(remediation);
    }

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    @Override
    public int compareTo(Finding other) {
        return ORDER.compare(this, other);
    }
}
