package com.ecoauditor.core.audit;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.graph.EcosystemGraph;
import com.ecoauditor.core.graph.GraphBuilder;
import com.ecoauditor.core.loader.LoadResult;
import com.ecoauditor.core.loader.MetadataLoader;
import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.probe.LinkProber;
import com.ecoauditor.core.probe.ProbeSettings;
import com.ecoauditor.core.report.AuditReport;
import com.ecoauditor.core.report.ReportBuilder;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleEngine;
import com.ecoauditor.core.rule.RuleEngineResult;
import com.ecoauditor.core.util.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs a complete audit: load the index, build the graph, run the rules, build the report.
 *
 * <p>Each call works on freshly loaded input and keeps no state between runs. A
 * {@link com.ecoauditor.core.loader.MalformedMetadataException} from loading propagates to
 * the caller; every other problem ends up in the report. Cancelling the signal stops the run
 * at the next rule boundary (or aborts in-flight link probes) and the partial report is
 * returned flagged as incomplete.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EcosystemAuditor auditor = new EcosystemAuditor(ConfigLoader.load(configPath));
 * AuditReport report = auditor.audit(indexFile, overridesDir, CancellationSignal.create());
 * if (!report.passed()) {
 *     ...
 * }
 * }</pre>
 */
public class EcosystemAuditor {

    private static final Logger log = LoggerFactory.getLogger(EcosystemAuditor.class);

    private final AuditConfig config;
    private final RuleEngine ruleEngine;
    private final Clock clock;
    private final Function<ProbeSettings, LinkProber> proberFactory;

    public EcosystemAuditor(AuditConfig config) {
        this(config, new RuleEngine(), Clock.systemUTC(), LinkProber::new);
    }

    public EcosystemAuditor(AuditConfig config, RuleEngine ruleEngine, Clock clock,
                            Function<ProbeSettings, LinkProber> proberFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.proberFactory = Objects.requireNonNull(proberFactory, "proberFactory must not be null");
    }

    public AuditConfig getConfig() {
        return config;
    }

    /**
     * Loads and audits an index file.
     *
     * @param indexFile ecosystem index (JSON or YAML)
     * @param overridesDir per-repository overrides, or null
     * @param cancellation external cancellation signal
     * @return audit report
     * @throws com.ecoauditor.core.loader.MalformedMetadataException if the input is malformed
     */
    public AuditReport audit(Path indexFile, Path overridesDir, CancellationSignal cancellation) {
        LoadResult loaded = new MetadataLoader(config.shortDescriptionMaxLength()).load(indexFile, overridesDir);
        return audit(loaded, cancellation);
    }

    /**
     * Audits an already loaded index, merging the loader findings into the report.
     *
     * @param loaded load result
     * @param cancellation external cancellation signal
     * @return audit report
     */
    public AuditReport audit(LoadResult loaded, CancellationSignal cancellation) {
        EcosystemIndex index = loaded.index();
        EcosystemGraph graph = new GraphBuilder().build(index);
        AuditContext context = new AuditContext(index, graph, config, clock, proberFactory, cancellation);

        RuleEngineResult result = ruleEngine.run(context);
        AuditReport report = new ReportBuilder()
            .addFindings(loaded.findings())
            .addRuleResults(result)
            .build();

        log.info("Audit of {} repositories finished: {}{}", index.size(), report.status(),
            report.complete() ? "" : " (incomplete)");
        return report;
    }

    /**
     * Audits an in-memory index without loader findings.
     *
     * @param index ecosystem index
     * @return audit report
     */
    public AuditReport audit(EcosystemIndex index) {
        return audit(new LoadResult(index, List.of()), CancellationSignal.create());
    }
}
