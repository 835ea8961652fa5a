package com.ecoauditor.core.probe;

import com.ecoauditor.core.config.AuditConfig;

/**
 * Tuning of a probing run.
 *
 * @param concurrency maximum concurrent probes
 * @param timeoutMs per-request timeout
 * @param retries retries for transient failures
 * @param retryBackoffMs linear backoff step; attempt {@code n} waits {@code n * retryBackoffMs}
 * @param budgetMs wall-clock budget for the whole run
 */
public record ProbeSettings(
    int concurrency,
    int timeoutMs,
    int retries,
    int retryBackoffMs,
    long budgetMs
) {
    public ProbeSettings {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (retries < 0 || retryBackoffMs < 0) {
            throw new IllegalArgumentException("retries and retryBackoffMs must be >= 0");
        }
        if (budgetMs <= 0) {
            throw new IllegalArgumentException("budgetMs must be > 0");
        }
    }

    public static ProbeSettings from(AuditConfig config) {
        return new ProbeSettings(config.concurrency(), config.timeoutMs(), config.retries(),
            config.retryBackoffMs(), config.probeBudgetMs());
    }
}
