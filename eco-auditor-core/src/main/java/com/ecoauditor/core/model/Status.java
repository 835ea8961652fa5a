package com.ecoauditor.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maturity status declared by a repository.
 */
public enum Status {
    ALPHA,
    BETA,
    STABLE,
    DEPRECATED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a declared value, ignoring case and surrounding whitespace.
     *
     * @param value declared value, may be null
     * @return matching status, or empty if the value is not a member
     */
    public static Optional<Status> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(status -> status.wireName().equalsIgnoreCase(normalized))
            .findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(Status::wireName).toList();
    }
}
