package com.ecoauditor.core.graph;

import com.ecoauditor.core.model.DeclaredDependency;
import com.ecoauditor.core.model.DependencyEdge;
import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.model.RepositoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assembles an {@link EcosystemGraph} from a loaded index.
 *
 * <p>Declared dependencies that do not resolve to a known repository are kept as
 * {@link UnresolvedDependency} entries and omitted from the edge set; building never fails
 * because of them.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private static final int UNDEFINED = -1;

    private static final Comparator<DependencyEdge> EDGE_ORDER = Comparator
        .comparing(DependencyEdge::source)
        .thenComparing(DependencyEdge::target)
        .thenComparing(DependencyEdge::type);

    /**
     * Builds the dependency graph.
     *
     * @param index loaded ecosystem index
     * @return immutable graph
     */
    public EcosystemGraph build(EcosystemIndex index) {
        Map<String, RepositoryRecord> records = index.records();

        Set<DependencyEdge> edgeSet = new LinkedHashSet<>();
        List<UnresolvedDependency> unresolved = new ArrayList<>();
        for (RepositoryRecord record : records.values()) {
            for (DeclaredDependency dependency : record.dependencies()) {
                if (records.containsKey(dependency.name())) {
                    edgeSet.add(new DependencyEdge(record.name(), dependency.name(), dependency.type()));
                } else {
                    unresolved.add(new UnresolvedDependency(record.name(), dependency.name(), dependency.type()));
                }
            }
        }
        List<DependencyEdge> edges = new ArrayList<>(edgeSet);
        edges.sort(EDGE_ORDER);

        Map<String, Integer> reverseCounts = new HashMap<>();
        records.keySet().forEach(name -> reverseCounts.put(name, 0));
        edges.forEach(edge -> reverseCounts.merge(edge.target(), 1, Integer::sum));

        SortedSet<String> nodes = new TreeSet<>(records.keySet());
        Map<String, SortedSet<String>> directAdjacency = adjacency(edges, true);
        Map<String, SortedSet<String>> allAdjacency = adjacency(edges, false);

        List<DependencyCycle> directCycles = CycleDetector.findCycles(nodes, directAdjacency).stream()
            .map(path -> new DependencyCycle(path, true))
            .toList();
        Set<SortedSet<String>> directSets = new HashSet<>();
        directCycles.forEach(cycle -> directSets.add(cycle.nodeSet()));

        List<DependencyCycle> nonDirectCycles = CycleDetector.findCycles(nodes, allAdjacency).stream()
            .filter(path -> !directSets.contains(new TreeSet<>(path)))
            .map(path -> new DependencyCycle(path, false))
            .toList();

        Map<String, Integer> depths = computeDepths(nodes, directAdjacency);

        log.debug("Built graph: {} nodes, {} edges, {} unresolved, {} direct cycles, {} non-direct cycles",
            nodes.size(), edges.size(), unresolved.size(), directCycles.size(), nonDirectCycles.size());

        return new EcosystemGraph(new TreeMap<>(records), edges, unresolved, directCycles, nonDirectCycles,
            reverseCounts, depths);
    }

    private static Map<String, SortedSet<String>> adjacency(List<DependencyEdge> edges, boolean directOnly) {
        Map<String, SortedSet<String>> adjacency = new HashMap<>();
        for (DependencyEdge edge : edges) {
            if (!directOnly || edge.isDirect()) {
                adjacency.computeIfAbsent(edge.source(), key -> new TreeSet<>()).add(edge.target());
            }
        }
        return adjacency;
    }

    private static Map<String, Integer> computeDepths(SortedSet<String> nodes, Map<String, SortedSet<String>> directAdjacency) {
        Map<String, Integer> memo = new HashMap<>();
        Set<String> inProgress = new HashSet<>();
        for (String node : nodes) {
            depth(node, directAdjacency, memo, inProgress);
        }
        Map<String, Integer> depths = new HashMap<>();
        memo.forEach((node, depth) -> {
            if (depth != UNDEFINED) {
                depths.put(node, depth);
            }
        });
        return depths;
    }

    private static int depth(String node, Map<String, SortedSet<String>> adjacency,
                             Map<String, Integer> memo, Set<String> inProgress) {
        Integer known = memo.get(node);
        if (known != null) {
            return known;
        }
        if (!inProgress.add(node)) {
            // Back on the current path: the node lies on a direct cycle.
            return UNDEFINED;
        }
        int result = 0;
        for (String next : adjacency.getOrDefault(node, new TreeSet<>())) {
            int nextDepth = depth(next, adjacency, memo, inProgress);
            if (nextDepth == UNDEFINED) {
                result = UNDEFINED;
            } else if (result != UNDEFINED) {
                result = Math.max(result, nextDepth + 1);
            }
        }
        inProgress.remove(node);
        memo.put(node, result);
        return result;
    }
}
