package com.ecoauditor.core.graph;

import com.ecoauditor.core.model.EdgeType;

import java.util.Objects;

/**
 * Declared dependency whose target is not part of the index.
 *
 * @param source repository declaring the dependency
 * @param target name that could not be resolved
 * @param type declared relationship kind
 */
public record UnresolvedDependency(String source, String target, EdgeType type) {

    public UnresolvedDependency {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
