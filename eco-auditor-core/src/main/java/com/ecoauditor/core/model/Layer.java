package com.ecoauditor.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Architectural layer a repository belongs to.
 *
 * <p>The set is closed: descriptors declaring any other value fail the completeness rule.
 */
public enum Layer {
    PROTOCOL,
    LANGUAGE,
    RUNTIME,
    APPLICATION,
    INFRASTRUCTURE,
    RESEARCH;

    /**
     * Returns the lower-case value used in index files.
     *
     * @return wire name, e.g. {@code "runtime"}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a declared value, ignoring case and surrounding whitespace.
     *
     * @param value declared value, may be null
     * @return matching layer, or empty if the value is not a member
     */
    public static Optional<Layer> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(layer -> layer.wireName().equalsIgnoreCase(normalized))
            .findFirst();
    }

    /**
     * Returns all wire names in declaration order.
     *
     * @return valid layer values
     */
    public static List<String> wireNames() {
        return Arrays.stream(values()).map(Layer::wireName).toList();
    }
}
