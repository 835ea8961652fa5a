package com.ecoauditor.core.model;

import java.util.Locale;

/**
 * Severity of an audit finding.
 *
 * <p>Declaration order is the ranking used for report ordering: {@link #BLOCKING} first.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Fails the audit gate.
     */
    BLOCKING,

    /**
     * Should be reviewed; does not fail the gate.
     */
    WARNING,

    /**
     * Informational - no action required, just for awareness.
     */
    INFO;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
