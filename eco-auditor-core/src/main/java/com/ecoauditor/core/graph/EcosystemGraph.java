package com.ecoauditor.core.graph;

import com.ecoauditor.core.model.DependencyEdge;
import com.ecoauditor.core.model.Layer;
import com.ecoauditor.core.model.RepositoryRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Directed dependency graph of the ecosystem with its computed attributes.
 *
 * <p>Instances are immutable and built by {@link GraphBuilder}; a new graph is built for every
 * audit run.
 */
public final class EcosystemGraph {

    private final SortedMap<String, RepositoryRecord> records;
    private final List<DependencyEdge> edges;
    private final List<UnresolvedDependency> unresolved;
    private final List<DependencyCycle> directCycles;
    private final List<DependencyCycle> nonDirectCycles;
    private final Map<String, Integer> reverseDependencyCounts;
    private final Map<String, Integer> depths;

    EcosystemGraph(
        SortedMap<String, RepositoryRecord> records,
        List<DependencyEdge> edges,
        List<UnresolvedDependency> unresolved,
        List<DependencyCycle> directCycles,
        List<DependencyCycle> nonDirectCycles,
        Map<String, Integer> reverseDependencyCounts,
        Map<String, Integer> depths
    ) {
        this.records = Collections.unmodifiableSortedMap(new TreeMap<>(records));
        this.edges = List.copyOf(edges);
        this.unresolved = List.copyOf(unresolved);
        this.directCycles = List.copyOf(directCycles);
        this.nonDirectCycles = List.copyOf(nonDirectCycles);
        this.reverseDependencyCounts = Map.copyOf(reverseDependencyCounts);
        this.depths = Map.copyOf(depths);
    }

    public SortedMap<String, RepositoryRecord> records() {
        return records;
    }

    public Optional<RepositoryRecord> record(String name) {
        return Optional.ofNullable(records.get(name));
    }

    public int size() {
        return records.size();
    }

    /**
     * Returns resolved edges sorted by source, target and type.
     *
     * @return all edges
     */
    public List<DependencyEdge> edges() {
        return edges;
    }

    public List<DependencyEdge> outgoing(String name) {
        return edges.stream().filter(edge -> edge.source().equals(name)).toList();
    }

    public List<DependencyEdge> incoming(String name) {
        return edges.stream().filter(edge -> edge.target().equals(name)).toList();
    }

    public List<UnresolvedDependency> unresolvedDependencies() {
        return unresolved;
    }

    /**
     * Returns the distinct cycles formed by direct edges only.
     *
     * @return direct cycles
     */
    public List<DependencyCycle> directCycles() {
        return directCycles;
    }

    /**
     * Returns cycles that involve at least one conceptual, test or example edge and whose
     * member set is not already a direct cycle.
     *
     * @return non-direct cycles
     */
    public List<DependencyCycle> nonDirectCycles() {
        return nonDirectCycles;
    }

    /**
     * Returns the number of resolved edges of any type targeting a node.
     *
     * @param name repository name
     * @return reverse-dependency count, 0 for unknown names
     */
    public int reverseDependencyCount(String name) {
        return reverseDependencyCounts.getOrDefault(name, 0);
    }

    /**
     * Returns the topological depth over direct edges.
     *
     * @param name repository name
     * @return depth, or empty when the node is on or depends on a direct cycle
     */
    public OptionalInt topologicalDepth(String name) {
        Integer depth = depths.get(name);
        return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
    }

    public boolean isCentral(String name, int threshold) {
        return reverseDependencyCount(name) >= threshold;
    }

    /**
     * Groups repository names by layer, in layer order; repositories without a valid layer
     * are omitted.
     *
     * @return layer members
     */
    public Map<Layer, List<String>> membersByLayer() {
        Map<Layer, List<String>> members = new EnumMap<>(Layer.class);
        for (Layer layer : Layer.values()) {
            members.put(layer, new ArrayList<>());
        }
        records.values().stream()
            .filter(record -> record.layer() != null)
            .forEach(record -> members.get(record.layer()).add(record.name()));
        members.replaceAll((layer, names) -> List.copyOf(names));
        return Collections.unmodifiableMap(members);
    }
}
