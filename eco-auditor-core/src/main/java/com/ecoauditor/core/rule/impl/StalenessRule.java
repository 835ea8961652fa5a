package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Layer;
import com.ecoauditor.core.model.RepositoryRecord;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.base.AbstractAuditRule;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares published statistics with the live graph and flags repositories without recent
 * activity.
 *
 * <p>Checked statistics:
 * <ul>
 *   <li>the index's {@code total_repos} against the number of repositories</li>
 *   <li>the index's per-layer counts against the layer membership</li>
 *   <li>a repository's {@code repo_count} field against the number of repositories</li>
 *   <li>"N repos" statements in descriptions against the number of repositories</li>
 * </ul>
 * Mismatches are warnings carrying both values. A non-deprecated repository whose
 * {@code last_updated} is older than the configured threshold gets an informational
 * deprecation suggestion; its status is never changed.
 */
public class StalenessRule extends AbstractAuditRule {

    public static final String ID = "staleness";

    private static final Pattern REPO_COUNT_STATEMENT =
        Pattern.compile("\\b(\\d+)\\+?\\s*(?:repos?|repositories)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Statistics Staleness";
    }

    @Override
    public Category getCategory() {
        return Category.STALENESS;
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public RuleResult evaluate(AuditContext context) {
        List<Finding> findings = new ArrayList<>();
        int liveCount = context.graph().size();

        checkIndexStatistics(context, liveCount, findings);
        for (RepositoryRecord record : records(context)) {
            checkPublishedCounts(record, liveCount, findings);
            checkActivity(record, context, findings);
        }
        return result(findings);
    }

    private void checkIndexStatistics(AuditContext context, int liveCount, List<Finding> findings) {
        EcosystemIndex index = context.index();
        if (index.declaredTotalRepos() != null && index.declaredTotalRepos() != liveCount) {
            findings.add(Finding.warning(Category.STALENESS, "index",
                    "Published total_repos is " + index.declaredTotalRepos() + " but the index lists "
                        + liveCount + " repositories")
                .withRemediation("Regenerate the index statistics"));
        }

        Map<Layer, List<String>> members = context.graph().membersByLayer();
        for (Map.Entry<Layer, Integer> declared : index.declaredLayerCounts().entrySet()) {
            int live = members.getOrDefault(declared.getKey(), List.of()).size();
            if (declared.getValue() != live) {
                findings.add(Finding.warning(Category.STALENESS, "index",
                        "Published count for layer '" + declared.getKey().wireName() + "' is "
                            + declared.getValue() + " but the layer has " + live + " repositories")
                    .withRemediation("Regenerate the index statistics"));
            }
        }
    }

    private void checkPublishedCounts(RepositoryRecord record, int liveCount, List<Finding> findings) {
        if (record.declaredRepoCount() != null && record.declaredRepoCount() != liveCount) {
            findings.add(Finding.warning(Category.STALENESS, record.name(),
                    "Published repo_count is " + record.declaredRepoCount() + " but the ecosystem has "
                        + liveCount + " repositories")
                .withRemediation("Update repo_count to " + liveCount));
        }

        SortedSet<Integer> stated = new TreeSet<>();
        stated.addAll(statedCounts(record.shortDescription()));
        stated.addAll(statedCounts(record.longDescription()));
        for (Integer count : stated) {
            if (count != liveCount) {
                findings.add(Finding.warning(Category.STALENESS, record.name(),
                        "Description states " + count + " repos but the ecosystem has " + liveCount)
                    .withRemediation("Update the description to " + liveCount + " repos"));
            }
        }
    }

    private void checkActivity(RepositoryRecord record, AuditContext context, List<Finding> findings) {
        LocalDate lastUpdated = record.lastUpdated();
        if (lastUpdated == null || record.isDeprecated()) {
            return;
        }
        long age = ChronoUnit.DAYS.between(lastUpdated, context.today());
        int threshold = context.config().stalenessThresholdDays();
        if (age > threshold) {
            findings.add(Finding.info(Category.STALENESS, record.name(),
                    "No update for " + age + " days (threshold " + threshold + "); candidate for deprecated status")
                .withRemediation("Review the repository and set status: deprecated if it is no longer maintained"));
        }
    }

    private static List<Integer> statedCounts(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Integer> counts = new ArrayList<>();
        Matcher matcher = REPO_COUNT_STATEMENT.matcher(text);
        while (matcher.find()) {
            try {
                counts.add(Integer.parseInt(matcher.group(1)));
            } catch (NumberFormatException e) {
                // Digits beyond int range cannot be a repository count.
                counts.add(Integer.MAX_VALUE);
            }
        }
        return counts;
    }
}
