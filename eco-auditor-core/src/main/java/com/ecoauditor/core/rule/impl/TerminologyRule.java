package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.config.AuditConfig.TerminologyEntry;
import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.RepositoryRecord;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.base.AbstractAuditRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Flags discouraged wording in repository descriptions.
 *
 * <p>Each configured {@code terminology} entry is a case-insensitive regular expression and
 * the advice shown when it matches. Entries with an invalid expression are logged and
 * skipped.
 */
public class TerminologyRule extends AbstractAuditRule {

    public static final String ID = "terminology";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Terminology";
    }

    @Override
    public Category getCategory() {
        return Category.METADATA;
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public boolean appliesTo(AuditContext context) {
        return super.appliesTo(context) && !context.config().terminology().isEmpty();
    }

    @Override
    public RuleResult evaluate(AuditContext context) {
        Map<Pattern, String> patterns = compile(context.config().terminology());
        List<Finding> findings = new ArrayList<>();

        for (RepositoryRecord record : records(context)) {
            for (Map.Entry<Pattern, String> entry : patterns.entrySet()) {
                check(record.name(), "short_description", record.shortDescription(), entry, findings);
                check(record.name(), "long_description", record.longDescription(), entry, findings);
            }
        }
        return result(findings);
    }

    private void check(String repository, String field, String text, Map.Entry<Pattern, String> entry,
                       List<Finding> findings) {
        if (text == null) {
            return;
        }
        Matcher matcher = entry.getKey().matcher(text);
        if (matcher.find()) {
            findings.add(Finding.warning(Category.METADATA, repository,
                    "Discouraged wording '" + matcher.group() + "' in " + field)
                .withRemediation(entry.getValue()));
        }
    }

    private Map<Pattern, String> compile(List<TerminologyEntry> entries) {
        Map<Pattern, String> patterns = new LinkedHashMap<>();
        for (TerminologyEntry entry : entries) {
            if (entry.pattern() == null || entry.pattern().isBlank()) {
                continue;
            }
            try {
                String advice = entry.advice() != null ? entry.advice() : "Avoid '" + entry.pattern() + "'";
                patterns.put(Pattern.compile(entry.pattern(), Pattern.CASE_INSENSITIVE), advice);
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid terminology pattern '{}': {}", entry.pattern(), e.getDescription());
            }
        }
        return patterns;
    }
}
