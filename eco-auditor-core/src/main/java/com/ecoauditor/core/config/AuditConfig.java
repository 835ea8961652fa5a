package com.ecoauditor.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Root configuration of an audit run.
 *
 * <p>Loaded from {@code ecoauditor.yaml}. Every option is optional; absent or invalid
 * values fall back to the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * concurrency: 8
 * timeout_ms: 5000
 * retries: 2
 * retry_backoff_ms: 250
 * probe_budget_ms: 60000
 * staleness_threshold_days: 90
 * central_threshold: 3
 * best_effort_hosts:
 *   - status.example.org
 *
 * rules:
 *   groups:
 *     - metadata
 *     - graph
 *
 * terminology:
 *   - pattern: "Active\\s+MirrorOS"
 *     advice: "Should be 'ActiveMirrorOS' (no space)"
 * terminology_file: terminology.yaml
 * overrides_dir: repos/
 * }</pre>
 *
 * @param concurrency maximum number of concurrent link probes
 * @param timeoutMs per-request probe timeout in milliseconds
 * @param retries retry count for transient probe failures
 * @param retryBackoffMs linear backoff step between retries
 * @param probeBudgetMs wall-clock budget for all probes of a run
 * @param stalenessThresholdDays age after which an untouched repository is a deprecation candidate
 * @param bestEffortHosts hosts whose dead links are only warnings
 * @param centralThreshold reverse-dependency count at which a node is central
 * @param shortDescriptionMaxLength maximum short description length
 * @param rules rule selection
 * @param terminology forbidden wording checked in descriptions
 * @param terminologyFile YAML list of further terminology entries
 * @param overridesDir directory of per-repository metadata overrides
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    @JsonProperty("concurrency") Integer concurrency,
    @JsonProperty("timeout_ms") Integer timeoutMs,
    @JsonProperty("retries") Integer retries,
    @JsonProperty("retry_backoff_ms") Integer retryBackoffMs,
    @JsonProperty("probe_budget_ms") Long probeBudgetMs,
    @JsonProperty("staleness_threshold_days") Integer stalenessThresholdDays,
    @JsonProperty("best_effort_hosts") Set<String> bestEffortHosts,
    @JsonProperty("central_threshold") Integer centralThreshold,
    @JsonProperty("short_description_max_length") Integer shortDescriptionMaxLength,
    @JsonProperty("rules") RuleSelection rules,
    @JsonProperty("terminology") List<TerminologyEntry> terminology,
    @JsonProperty("terminology_file") String terminologyFile,
    @JsonProperty("overrides_dir") String overridesDir
) {
    public static final int DEFAULT_CONCURRENCY = 8;
    public static final int DEFAULT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RETRIES = 2;
    public static final int DEFAULT_RETRY_BACKOFF_MS = 250;
    public static final long DEFAULT_PROBE_BUDGET_MS = 60_000L;
    public static final int DEFAULT_STALENESS_THRESHOLD_DAYS = 90;
    public static final int DEFAULT_CENTRAL_THRESHOLD = 3;
    public static final int DEFAULT_SHORT_DESCRIPTION_MAX_LENGTH = 150;

    /**
     * Compact constructor normalizing absent and out-of-range values to defaults.
     */
    public AuditConfig {
        concurrency = positiveOrDefault(concurrency, DEFAULT_CONCURRENCY);
        timeoutMs = positiveOrDefault(timeoutMs, DEFAULT_TIMEOUT_MS);
        retries = retries == null || retries < 0 ? DEFAULT_RETRIES : retries;
        retryBackoffMs = retryBackoffMs == null || retryBackoffMs < 0 ? DEFAULT_RETRY_BACKOFF_MS : retryBackoffMs;
        probeBudgetMs = probeBudgetMs == null || probeBudgetMs <= 0 ? DEFAULT_PROBE_BUDGET_MS : probeBudgetMs;
        stalenessThresholdDays = positiveOrDefault(stalenessThresholdDays, DEFAULT_STALENESS_THRESHOLD_DAYS);
        centralThreshold = positiveOrDefault(centralThreshold, DEFAULT_CENTRAL_THRESHOLD);
        shortDescriptionMaxLength = positiveOrDefault(shortDescriptionMaxLength, DEFAULT_SHORT_DESCRIPTION_MAX_LENGTH);

        Set<String> hosts = new TreeSet<>();
        if (bestEffortHosts != null) {
            bestEffortHosts.stream()
                .filter(host -> host != null && !host.isBlank())
                .map(host -> host.trim().toLowerCase(Locale.ROOT))
                .forEach(hosts::add);
        }
        bestEffortHosts = Set.copyOf(hosts);

        if (rules == null) {
            rules = RuleSelection.all();
        }
        terminology = terminology == null ? List.of() : List.copyOf(terminology);
        terminologyFile = terminologyFile == null || terminologyFile.isBlank() ? null : terminologyFile.trim();
        overridesDir = overridesDir == null || overridesDir.isBlank() ? null : overridesDir.trim();
    }

    /**
     * Creates a configuration with every default applied and all rules enabled.
     *
     * @return default configuration
     */
    public static AuditConfig defaults() {
        return new AuditConfig(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with a different rule selection.
     *
     * @param selection rule selection to apply
     * @return new configuration
     */
    public AuditConfig withRules(RuleSelection selection) {
        return new AuditConfig(concurrency, timeoutMs, retries, retryBackoffMs, probeBudgetMs,
            stalenessThresholdDays, bestEffortHosts, centralThreshold, shortDescriptionMaxLength,
            selection, terminology, terminologyFile, overridesDir);
    }

    /**
     * Returns a copy with resolved file locations and the full terminology list.
     *
     * @param allTerminology inline entries followed by those of the terminology file
     * @param resolvedTerminologyFile terminology file location, may be null
     * @param resolvedOverridesDir overrides directory location, may be null
     * @return new configuration
     */
    public AuditConfig withResolvedFiles(List<TerminologyEntry> allTerminology, String resolvedTerminologyFile,
                                         String resolvedOverridesDir) {
        return new AuditConfig(concurrency, timeoutMs, retries, retryBackoffMs, probeBudgetMs,
            stalenessThresholdDays, bestEffortHosts, centralThreshold, shortDescriptionMaxLength,
            rules, allTerminology, resolvedTerminologyFile, resolvedOverridesDir);
    }

    /**
     * Returns the configured overrides directory.
     *
     * @return overrides directory, empty when not configured
     */
    public Optional<Path> overridesDirectory() {
        return Optional.ofNullable(overridesDir).map(Path::of);
    }

    /**
     * Returns true when the host, or one of its parent domains, is configured as best-effort.
     *
     * @param host host name of a probed URL, may be null
     * @return whether dead links on the host are downgraded to warnings
     */
    public boolean isBestEffortHost(String host) {
        if (host == null || host.isBlank()) {
            return false;
        }
        String candidate = host.toLowerCase(Locale.ROOT);
        while (true) {
            if (bestEffortHosts.contains(candidate)) {
                return true;
            }
            int dot = candidate.indexOf('.');
            if (dot < 0) {
                return false;
            }
            candidate = candidate.substring(dot + 1);
        }
    }

    private static Integer positiveOrDefault(Integer value, int defaultValue) {
        return value == null || value <= 0 ? defaultValue : value;
    }

    /**
     * Rule selection.
     *
     * <p>When {@code groups} is non-empty, only rules in those groups run. Otherwise, when
     * {@code enabled} is non-empty, only the listed rule ids run. Otherwise all rules run.
     * Rule ids in {@code disabled} never run.
     *
     * @param enabled explicitly enabled rule ids
     * @param groups enabled rule groups (see {@link RuleGroups})
     * @param disabled rule ids excluded from the run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleSelection(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("groups") List<String> groups,
        @JsonProperty("disabled") List<String> disabled
    ) {
        public RuleSelection {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
            groups = groups == null ? List.of() : List.copyOf(groups);
            disabled = disabled == null ? List.of() : List.copyOf(disabled);
        }

        public static RuleSelection all() {
            return new RuleSelection(List.of(), List.of(), List.of());
        }

        public static RuleSelection groups(List<String> groups) {
            return new RuleSelection(List.of(), groups, List.of());
        }

        /**
         * Returns a copy that additionally excludes the given rule ids.
         *
         * @param ruleIds rule ids to exclude
         * @return new selection
         */
        public RuleSelection without(String... ruleIds) {
            List<String> excluded = new ArrayList<>(disabled);
            excluded.addAll(List.of(ruleIds));
            return new RuleSelection(enabled, groups, excluded);
        }

        /**
         * Checks if a rule is enabled.
         *
         * @param ruleId rule id to check
         * @return true if the rule should run
         */
        public boolean isEnabled(String ruleId) {
            if (disabled.contains(ruleId)) {
                return false;
            }
            if (!groups.isEmpty()) {
                return RuleGroups.getRuleIds(groups).contains(ruleId);
            }
            return enabled.isEmpty() || enabled.contains(ruleId);
        }
    }

    /**
     * Forbidden wording checked by the terminology rule.
     *
     * @param pattern case-insensitive regular expression
     * @param advice message shown when the pattern matches
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TerminologyEntry(
        @JsonProperty("pattern") String pattern,
        @JsonProperty("advice") String advice
    ) {}
}
