package com.ecoauditor.core.probe;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcomes of a probing run, keyed and sorted by URL.
 *
 * @param outcomes outcome per URL; every requested URL is present
 * @param interrupted true when the run was cancelled before all probes finished
 */
public record ProbeResults(SortedMap<String, ProbeOutcome> outcomes, boolean interrupted) {

    public ProbeResults {
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        outcomes = Collections.unmodifiableSortedMap(new TreeMap<>(outcomes));
    }

    public static ProbeResults empty() {
        return new ProbeResults(new TreeMap<>(), false);
    }

    public ProbeOutcome get(String url) {
        return outcomes.get(url);
    }
}
