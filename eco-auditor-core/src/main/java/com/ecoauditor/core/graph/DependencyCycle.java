package com.ecoauditor.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A loop in the dependency graph.
 *
 * <p>The path lists each member once, in edge order, rotated so that it starts with the
 * lexicographically smallest member. Two cycles are the same when their node sets are equal.
 *
 * @param path members in edge order
 * @param direct true when every edge of the loop is a direct dependency
 */
public record DependencyCycle(List<String> path, boolean direct) {

    public DependencyCycle {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        path = List.copyOf(rotateToSmallest(path));
    }

    /**
     * Returns the member set used to identify the cycle.
     *
     * @return sorted member names
     */
    public SortedSet<String> nodeSet() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(path));
    }

    public boolean contains(String name) {
        return path.contains(name);
    }

    /**
     * Renders the loop closed on its first member, e.g. {@code A -> B -> C -> A}.
     *
     * @return loop description
     */
    public String describe() {
        List<String> closed = new ArrayList<>(path);
        closed.add(path.get(0));
        return String.join(" -> ", closed);
    }

    private static List<String> rotateToSmallest(List<String> path) {
        int start = path.indexOf(Collections.min(path));
        List<String> rotated = new ArrayList<>(path.size());
        rotated.addAll(path.subList(start, path.size()));
        rotated.addAll(path.subList(0, start));
        return rotated;
    }
}
