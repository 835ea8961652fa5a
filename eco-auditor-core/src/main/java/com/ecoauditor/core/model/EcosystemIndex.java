package com.ecoauditor.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable input of one audit run: every repository descriptor of the ecosystem plus the
 * statistics the index publishes about itself.
 *
 * @param version index format or release label, may be null
 * @param records repositories keyed by name, sorted by name
 * @param declaredTotalRepos repository total published by the index, or null
 * @param declaredLayerCounts per-layer repository counts published by the index
 */
public record EcosystemIndex(
    String version,
    Map<String, RepositoryRecord> records,
    Integer declaredTotalRepos,
    Map<Layer, Integer> declaredLayerCounts
) {
    /**
     * Compact constructor with validation.
     */
    public EcosystemIndex {
        Objects.requireNonNull(records, "records must not be null");
        records = Collections.unmodifiableSortedMap(new TreeMap<>(records));
        declaredLayerCounts = declaredLayerCounts == null || declaredLayerCounts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(declaredLayerCounts));
    }

    /**
     * Creates an index without published statistics.
     *
     * @param records repositories
     * @return new index
     */
    public static EcosystemIndex of(Collection<RepositoryRecord> records) {
        Map<String, RepositoryRecord> byName = new TreeMap<>();
        for (RepositoryRecord record : records) {
            byName.putIfAbsent(record.name(), record);
        }
        return new EcosystemIndex(null, byName, null, Map.of());
    }

    public int size() {
        return records.size();
    }

    public boolean contains(String name) {
        return records.containsKey(name);
    }
}
