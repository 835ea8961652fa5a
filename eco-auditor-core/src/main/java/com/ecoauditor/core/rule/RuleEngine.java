package com.ecoauditor.core.rule;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.config.RuleGroups;
import com.ecoauditor.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the selected audit rules against one context.
 *
 * <p>Rules run sequentially in priority order (ties broken by id). A rule that throws does
 * not stop the run: the exception is logged and converted into a blocking finding in the
 * rule's category, with the rule id as subject, so a broken check can never let the gate
 * pass. Cancellation is checked between rules; rules that did not start are skipped and
 * the result is marked incomplete.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private static final Comparator<AuditRule> EXECUTION_ORDER = Comparator
        .comparingInt(AuditRule::getPriority)
        .thenComparing(AuditRule::getId);

    private final List<AuditRule> rules;

    /**
     * Creates an engine with the rules registered through {@link ServiceLoader}.
     */
    public RuleEngine() {
        this(discoverRules());
    }

    public RuleEngine(List<AuditRule> rules) {
        List<AuditRule> sorted = new ArrayList<>(rules);
        sorted.sort(EXECUTION_ORDER);
        this.rules = List.copyOf(sorted);
    }

    /**
     * Discovers all available rules via SPI.
     *
     * @return rules in execution order
     */
    public static List<AuditRule> discoverRules() {
        log.debug("Discovering audit rules via ServiceLoader");
        ServiceLoader<AuditRule> loader = ServiceLoader.load(AuditRule.class);
        List<AuditRule> discovered = new ArrayList<>();
        loader.forEach(discovered::add);
        discovered.sort(EXECUTION_ORDER);

        log.debug("Discovered {} audit rules", discovered.size());
        if (log.isDebugEnabled()) {
            discovered.forEach(rule -> log.debug("  - {} ({})", rule.getId(), rule.getDisplayName()));
        }
        return discovered;
    }

    public List<AuditRule> getRules() {
        return rules;
    }

    /**
     * Returns the rules enabled by the configuration, in execution order.
     *
     * @param config audit configuration
     * @return selected rules
     */
    public List<AuditRule> selectRules(AuditConfig config) {
        warnAboutUnknownSelections(config.rules());
        return rules.stream()
            .filter(rule -> config.rules().isEnabled(rule.getId()))
            .toList();
    }

    /**
     * Runs every selected and applicable rule.
     *
     * @param context audit context
     * @return results of the executed rules
     */
    public RuleEngineResult run(AuditContext context) {
        List<AuditRule> selected = selectRules(context.config());
        List<RuleResult> results = new ArrayList<>();
        boolean complete = true;
        int notApplicable = 0;

        for (AuditRule rule : selected) {
            if (context.cancellation().isCancelled()) {
                log.warn("Audit cancelled; skipping rule {} and the rules after it", rule.getId());
                complete = false;
                break;
            }
            RuleResult result = runRule(rule, context);
            if (result == null) {
                notApplicable++;
                continue;
            }
            results.add(result);
            complete &= result.complete();
        }

        log.debug("Rule execution summary: {} executed, {} not applicable, {} not selected",
            results.size(), notApplicable, rules.size() - selected.size());
        return new RuleEngineResult(results, complete);
    }

    private RuleResult runRule(AuditRule rule, AuditContext context) {
        try {
            if (!rule.appliesTo(context)) {
                log.debug("Rule {} has nothing to check", rule.getId());
                return null;
            }
            log.info("Running rule: {} ({})", rule.getDisplayName(), rule.getId());
            RuleResult result = rule.evaluate(context);
            log.debug("Rule {} produced {} findings", rule.getId(), result.findings().size());
            return result;
        } catch (RuntimeException e) {
            log.error("Rule {} failed: {}", rule.getId(), e.getMessage(), e);
            Finding failure = Finding.blocking(
                rule.getCategory(),
                rule.getId(),
                "Rule failed to run: " + e.getClass().getSimpleName()
                    + (e.getMessage() != null ? ": " + e.getMessage() : "")
            ).withRemediation("Fix the rule failure and rerun the audit; the gate cannot pass without this check");
            return RuleResult.of(rule.getId(), List.of(failure));
        }
    }

    private void warnAboutUnknownSelections(AuditConfig.RuleSelection selection) {
        Set<String> availableIds = rules.stream()
            .map(AuditRule::getId)
            .collect(Collectors.toSet());

        List<String> unknownIds = selection.enabled().stream()
            .filter(id -> !availableIds.contains(id))
            .toList();
        if (!unknownIds.isEmpty()) {
            log.warn("Unknown rule IDs in configuration: {} (available: {})", unknownIds, availableIds);
        }

        List<String> unknownGroups = selection.groups().stream()
            .filter(group -> !RuleGroups.isValidGroup(group))
            .toList();
        if (!unknownGroups.isEmpty()) {
            log.warn("Unknown rule groups in configuration: {} (available: {})",
                unknownGroups, RuleGroups.GROUPS.keySet());
        }
    }
}
