package com.ecoauditor.core.rule.base;

import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.RepositoryRecord;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.AuditRule;
import com.ecoauditor.core.rule.RuleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Abstract base class for rule implementations.
 *
 * <p>Provides a logger per concrete rule class, an {@code appliesTo} default that runs
 * whenever the index is not empty, and {@link RuleResult} creation helpers.
 *
 * @see AuditRule
 */
public abstract class AbstractAuditRule implements AuditRule {

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    protected AbstractAuditRule() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public boolean appliesTo(AuditContext context) {
        return context.index().size() > 0;
    }

    /**
     * Returns the records to check, in name order.
     *
     * @param context audit context
     * @return repository records
     */
    protected Collection<RepositoryRecord> records(AuditContext context) {
        return context.graph().records().values();
    }

    protected RuleResult emptyResult() {
        return RuleResult.empty(getId());
    }

    protected RuleResult result(List<Finding> findings) {
        return RuleResult.of(getId(), findings);
    }

    protected RuleResult partialResult(List<Finding> findings) {
        return new RuleResult(getId(), findings, false);
    }
}
