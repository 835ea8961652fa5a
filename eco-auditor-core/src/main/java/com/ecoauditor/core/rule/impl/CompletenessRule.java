package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Layer;
import com.ecoauditor.core.model.RepositoryRecord;
import com.ecoauditor.core.model.Status;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.base.AbstractAuditRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that {@code layer} and {@code status} are members of their closed enumerations.
 *
 * <p>Missing required fields are reported while loading; this rule covers values that are
 * present but not valid, listing the accepted values in the remediation.
 */
public class CompletenessRule extends AbstractAuditRule {

    public static final String ID = "completeness";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Metadata Completeness";
    }

    @Override
    public Category getCategory() {
        return Category.METADATA;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public RuleResult evaluate(AuditContext context) {
        List<Finding> findings = new ArrayList<>();
        for (RepositoryRecord record : records(context)) {
            if (record.declaredLayer() != null && record.layer() == null) {
                findings.add(Finding.blocking(Category.METADATA, record.name(),
                        "Invalid layer '" + record.declaredLayer() + "'")
                    .withRemediation("Use one of: " + String.join(", ", Layer.wireNames())));
            }
            if (record.declaredStatus() != null && record.status() == null) {
                findings.add(Finding.blocking(Category.METADATA, record.name(),
                        "Invalid status '" + record.declaredStatus() + "'")
                    .withRemediation("Use one of: " + String.join(", ", Status.wireNames())));
            }
        }
        log.debug("Checked enumeration membership of {} records", context.graph().size());
        return result(findings);
    }
}
