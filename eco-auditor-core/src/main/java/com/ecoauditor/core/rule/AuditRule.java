package com.ecoauditor.core.rule;

import com.ecoauditor.core.model.Category;

/**
 * An independent consistency check over the ecosystem graph.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI) and run by the
 * {@link RuleEngine} in priority order (lower numbers first). A rule only reads the
 * {@link AuditContext} it is given and returns its findings in a {@link RuleResult};
 * rules never see each other's results.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.ecoauditor.core.rule.AuditRule}
 *
 * @see AuditContext
 * @see RuleResult
 */
public interface AuditRule {

    /**
     * Returns unique identifier for this rule.
     *
     * <p>Used in configuration ({@code rules.enabled}), rule groups and crash findings.
     * Should be kebab-case (e.g., "cycle-freedom", "link-liveness").
     *
     * @return unique rule identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this rule, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the category of the findings this rule produces.
     *
     * @return finding category
     */
    Category getCategory();

    /**
     * Returns execution priority for this rule.
     *
     * <p>Lower values execute first. Recommended ranges:
     * <ul>
     *   <li>1-50: offline metadata and graph checks</li>
     *   <li>50-100: statistics checks</li>
     *   <li>100+: checks that touch the network</li>
     * </ul>
     *
     * @return priority value (lower = earlier execution)
     */
    int getPriority();

    /**
     * Returns true when the rule issues network requests.
     *
     * @return whether the rule needs network access
     */
    default boolean requiresNetwork() {
        return false;
    }

    /**
     * Checks if this rule has anything to evaluate in the given context.
     *
     * @param context audit context
     * @return true if the rule should execute
     */
    boolean appliesTo(AuditContext context);

    /**
     * Evaluates the rule.
     *
     * <p>Problems with the audited ecosystem are returned as findings. An exception thrown
     * from this method is treated by the engine as a failure of the rule itself.
     *
     * @param context audit context
     * @return rule result
     */
    RuleResult evaluate(AuditContext context);
}
