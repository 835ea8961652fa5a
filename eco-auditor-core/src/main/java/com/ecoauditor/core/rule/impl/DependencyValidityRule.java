package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.graph.UnresolvedDependency;
import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.base.AbstractAuditRule;

import java.util.List;

/**
 * Reports every declared dependency whose target is not a repository of the index.
 */
public class DependencyValidityRule extends AbstractAuditRule {

    public static final String ID = "dependency-validity";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Dependency Validity";
    }

    @Override
    public Category getCategory() {
        return Category.DEPENDENCY;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public RuleResult evaluate(AuditContext context) {
        List<Finding> findings = context.graph().unresolvedDependencies().stream()
            .map(this::toFinding)
            .toList();
        if (!findings.isEmpty()) {
            log.debug("{} unresolved dependencies", findings.size());
        }
        return result(findings);
    }

    private Finding toFinding(UnresolvedDependency dependency) {
        return Finding.blocking(Category.DEPENDENCY, dependency.source(),
                "Unresolved dependency '" + dependency.target() + "' (" + dependency.type().wireName() + ")")
            .withRemediation("Add '" + dependency.target() + "' to the index or remove it from the dependencies");
    }
}
