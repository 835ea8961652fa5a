package com.ecoauditor.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of relationship expressed by a dependency edge.
 *
 * <p>Only {@link #DIRECT} edges take part in hard cycle validation and topological depth.
 * Conceptual, test and example relationships may legitimately be mutual.
 */
public enum EdgeType {
    /** Build or runtime dependency. */
    DIRECT,
    /** Shared ideas or protocol lineage, no code dependency. */
    CONCEPTUAL,
    /** Used only by the dependent's tests. */
    TEST,
    /** Used only by examples or demos. */
    EXAMPLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EdgeType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(type -> type.wireName().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
