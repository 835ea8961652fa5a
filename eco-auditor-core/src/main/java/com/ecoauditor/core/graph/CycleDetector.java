package com.ecoauditor.core.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Elementary cycle enumeration (Johnson's algorithm).
 *
 * <p>For every start node, in name order, the search walks only nodes that sort after it, so
 * each loop is found from its smallest member and no pruning depends on visit order. The
 * blocked set and its back-map keep the walk from re-entering a node until a path through it
 * can close a new loop. Loops with the same member set are reported once, with the first
 * path found in name order.
 */
final class CycleDetector {

    private final Map<String, SortedSet<String>> adjacency;
    private final List<String> stack = new ArrayList<>();
    private final Set<String> blocked = new HashSet<>();
    private final Map<String, Set<String>> blockedBy = new HashMap<>();
    private final Set<SortedSet<String>> seen = new HashSet<>();
    private final List<List<String>> cycles = new ArrayList<>();
    private String start;

    private CycleDetector(Map<String, SortedSet<String>> adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * Finds the distinct cycles of a graph.
     *
     * @param nodes all node names
     * @param adjacency outgoing neighbours per node; nodes without entry have none
     * @return cycle paths starting at their smallest member, one per member set
     */
    static List<List<String>> findCycles(SortedSet<String> nodes, Map<String, SortedSet<String>> adjacency) {
        CycleDetector detector = new CycleDetector(adjacency);
        for (String node : nodes) {
            detector.start = node;
            detector.blocked.clear();
            detector.blockedBy.clear();
            detector.circuit(node);
        }
        return detector.cycles;
    }

    private boolean circuit(String node) {
        boolean closed = false;
        stack.add(node);
        blocked.add(node);

        for (String next : successors(node)) {
            if (next.equals(start)) {
                record(new ArrayList<>(stack));
                closed = true;
            } else if (!blocked.contains(next) && circuit(next)) {
                closed = true;
            }
        }

        if (closed) {
            unblock(node);
        } else {
            for (String next : successors(node)) {
                blockedBy.computeIfAbsent(next, key -> new HashSet<>()).add(node);
            }
        }
        stack.remove(stack.size() - 1);
        return closed;
    }

    private SortedSet<String> successors(String node) {
        return adjacency.getOrDefault(node, new TreeSet<>()).tailSet(start);
    }

    private void unblock(String node) {
        blocked.remove(node);
        Set<String> waiting = blockedBy.remove(node);
        if (waiting != null) {
            for (String other : waiting) {
                if (blocked.contains(other)) {
                    unblock(other);
                }
            }
        }
    }

    private void record(List<String> cycle) {
        if (seen.add(new TreeSet<>(cycle))) {
            cycles.add(cycle);
        }
    }
}
