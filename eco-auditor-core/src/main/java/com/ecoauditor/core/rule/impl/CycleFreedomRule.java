package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.graph.DependencyCycle;
import com.ecoauditor.core.graph.EcosystemGraph;
import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.RepositoryRecord;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.base.AbstractAuditRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports dependency cycles.
 *
 * <p>One finding per distinct cycle. A cycle of direct edges is blocking, unless one of its
 * members is deprecated and therefore about to leave the graph, in which case it is a
 * warning. Cycles that need a conceptual, test or example edge are warnings.
 */
public class CycleFreedomRule extends AbstractAuditRule {

    public static final String ID = "cycle-freedom";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Cycle Freedom";
    }

    @Override
    public Category getCategory() {
        return Category.DEPENDENCY;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public RuleResult evaluate(AuditContext context) {
        EcosystemGraph graph = context.graph();
        List<Finding> findings = new ArrayList<>();

        for (DependencyCycle cycle : graph.directCycles()) {
            List<String> deprecatedMembers = cycle.nodeSet().stream()
                .filter(name -> graph.record(name).map(RepositoryRecord::isDeprecated).orElse(false))
                .toList();
            String subject = String.join(", ", cycle.nodeSet());
            if (deprecatedMembers.isEmpty()) {
                findings.add(Finding.blocking(Category.DEPENDENCY, subject,
                        "Direct dependency cycle: " + cycle.describe())
                    .withRemediation("Break the cycle by removing or retyping one of its direct dependencies"));
            } else {
                findings.add(Finding.warning(Category.DEPENDENCY, subject,
                        "Direct dependency cycle through deprecated " + String.join(", ", deprecatedMembers)
                            + ": " + cycle.describe())
                    .withRemediation("Remove the deprecated repositories from the dependency graph"));
            }
        }

        for (DependencyCycle cycle : graph.nonDirectCycles()) {
            findings.add(Finding.warning(Category.DEPENDENCY, String.join(", ", cycle.nodeSet()),
                    "Non-direct dependency cycle: " + cycle.describe())
                .withRemediation("Check that the mutual conceptual, test or example relationships are intended"));
        }

        log.debug("Found {} direct and {} non-direct cycles",
            graph.directCycles().size(), graph.nonDirectCycles().size());
        return result(findings);
    }
}
