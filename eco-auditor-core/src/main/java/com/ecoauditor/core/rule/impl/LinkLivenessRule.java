package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Severity;
import com.ecoauditor.core.probe.LinkProber;
import com.ecoauditor.core.probe.ProbeOutcome;
import com.ecoauditor.core.probe.ProbeResults;
import com.ecoauditor.core.probe.ProbeSettings;
import com.ecoauditor.core.probe.ProbeStatus;
import com.ecoauditor.core.probe.UrlCollector;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.base.AbstractAuditRule;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Probes every external URL referenced by the ecosystem.
 *
 * <p>Each unique URL is probed once. A URL that does not answer with 2xx/3xx produces one
 * finding per referencing repository: blocking, or a warning when its host is configured
 * as best-effort. When the run is cancelled, URLs that were never probed produce no finding
 * and the result is marked incomplete.
 */
public class LinkLivenessRule extends AbstractAuditRule {

    public static final String ID = "link-liveness";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Link Liveness";
    }

    @Override
    public Category getCategory() {
        return Category.LINK;
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean requiresNetwork() {
        return true;
    }

    @Override
    public RuleResult evaluate(AuditContext context) {
        SortedMap<String, SortedSet<String>> references = UrlCollector.collect(context.index());
        if (references.isEmpty()) {
            log.debug("No external links referenced");
            return emptyResult();
        }

        ProbeResults results;
        try (LinkProber prober = context.proberFactory().apply(ProbeSettings.from(context.config()))) {
            results = prober.probe(references.keySet(), context.cancellation());
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, SortedSet<String>> entry : references.entrySet()) {
            ProbeOutcome outcome = results.get(entry.getKey());
            if (outcome == null || outcome.isReachable() || (results.interrupted() && neverProbed(outcome))) {
                continue;
            }
            Severity severity = context.config().isBestEffortHost(hostOf(entry.getKey()))
                ? Severity.WARNING
                : Severity.BLOCKING;
            for (String repository : entry.getValue()) {
                findings.add(new Finding(severity, Category.LINK, repository,
                    "Dead link " + entry.getKey() + " (" + outcome.describe() + ")",
                    "Fix or remove the link"));
            }
        }
        return results.interrupted() ? partialResult(findings) : result(findings);
    }

    private static boolean neverProbed(ProbeOutcome outcome) {
        return outcome.status() == ProbeStatus.TIMEOUT && outcome.attempts() == 0;
    }

    private static String hostOf(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        return parsed != null ? parsed.host() : null;
    }
}
