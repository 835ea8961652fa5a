package com.ecoauditor.core.rule;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.graph.EcosystemGraph;
import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.probe.LinkProber;
import com.ecoauditor.core.probe.ProbeSettings;
import com.ecoauditor.core.util.CancellationSignal;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.function.Function;

/**
 * Read-only input handed to every rule of one audit run.
 *
 * @param index loaded ecosystem index
 * @param graph graph built from the index
 * @param config audit configuration
 * @param clock clock used for age computations
 * @param proberFactory creates the link prober used by network rules
 * @param cancellation external cancellation signal of the run
 */
public record AuditContext(
    EcosystemIndex index,
    EcosystemGraph graph,
    AuditConfig config,
    Clock clock,
    Function<ProbeSettings, LinkProber> proberFactory,
    CancellationSignal cancellation
) {
    /**
     * Compact constructor with validation.
     */
    public AuditContext {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        if (config == null) {
            config = AuditConfig.defaults();
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
        if (proberFactory == null) {
            proberFactory = LinkProber::new;
        }
        if (cancellation == null) {
            cancellation = CancellationSignal.create();
        }
    }

    public static AuditContext of(EcosystemIndex index, EcosystemGraph graph, AuditConfig config) {
        return new AuditContext(index, graph, config, null, null, null);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
