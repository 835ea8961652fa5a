package com.ecoauditor.core.model;

import java.util.Objects;

/**
 * One entry of a descriptor's dependency list, before resolution.
 *
 * @param name name of the repository depended upon
 * @param type relationship kind; plain string entries are {@link EdgeType#DIRECT}
 */
public record DeclaredDependency(String name, EdgeType type) {

    public DeclaredDependency {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = EdgeType.DIRECT;
        }
    }

    public static DeclaredDependency direct(String name) {
        return new DeclaredDependency(name, EdgeType.DIRECT);
    }
}
