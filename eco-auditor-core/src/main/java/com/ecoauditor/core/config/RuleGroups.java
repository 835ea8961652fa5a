package com.ecoauditor.core.config;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named groups of audit rules.
 *
 * <p>Groups let users select related rules with a single entry:</p>
 * <pre>{@code
 * rules:
 *   groups:
 *     - graph
 *     - stats
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RuleGroups {

    private RuleGroups() {
        // Utility class
    }

    /**
     * Map of group names to rule IDs.
     */
    public static final Map<String, List<String>> GROUPS = Map.of(
        "metadata", List.of("completeness", "terminology"),
        "graph", List.of("dependency-validity", "cycle-freedom"),
        "links", List.of("link-liveness"),
        "stats", List.of("staleness")
    );

    /**
     * Groups that never touch the network.
     */
    public static final List<String> OFFLINE = List.of("metadata", "graph", "stats");

    /**
     * Returns all rule ids in the given groups. Unknown group names are ignored.
     *
     * @param groupNames group names
     * @return sorted rule ids
     */
    public static Set<String> getRuleIds(List<String> groupNames) {
        Set<String> ids = new TreeSet<>();
        for (String group : groupNames) {
            List<String> members = GROUPS.get(group);
            if (members != null) {
                ids.addAll(members);
            }
        }
        return ids;
    }

    /**
     * Returns the group containing a rule, or null.
     *
     * @param ruleId rule id
     * @return group name or null when the rule belongs to no group
     */
    public static String groupOf(String ruleId) {
        return GROUPS.entrySet().stream()
            .filter(entry -> entry.getValue().contains(ruleId))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(null);
    }

    public static boolean isValidGroup(String groupName) {
        return GROUPS.containsKey(groupName);
    }
}
