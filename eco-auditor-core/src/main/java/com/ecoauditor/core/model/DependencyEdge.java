package com.ecoauditor.core.model;

import java.util.Objects;

/**
 * Resolved dependency between two repositories of the index.
 *
 * <p>Edges are derived from declared dependencies; they are never declared directly.
 *
 * @param source dependent repository
 * @param target repository depended upon
 * @param type relationship kind
 */
public record DependencyEdge(
    String source,
    String target,
    EdgeType type
) {
    /**
     * Compact constructor with validation.
     */
    public DependencyEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public boolean isDirect() {
        return type == EdgeType.DIRECT;
    }
}
