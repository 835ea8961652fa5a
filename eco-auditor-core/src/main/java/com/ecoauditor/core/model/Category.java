package com.ecoauditor.core.model;

import java.util.Locale;

/**
 * Area of the ecosystem a finding concerns.
 */
public enum Category {
    METADATA,
    DEPENDENCY,
    LINK,
    STALENESS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
