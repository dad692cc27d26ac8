package com.semanticdiff.core.merge;

import java.util.Locale;

/**
 * How a three-way merge resolves a path changed on both sides.
 */
public enum MergeStrategy {
    /** Keep our value */
    OURS,

    /** Take their value (or their removal) */
    THEIRS,

    /** Keep both where the element allows it (entity properties), ours otherwise */
    UNION;

    /**
     * Parses a strategy name case-insensitively.
     *
     * @param value strategy name ("ours", "theirs", "union")
     * @return strategy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MergeStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Merge strategy must not be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown merge strategy: " + value
                + " (expected ours, theirs or union)", e);
        }
    }

    /**
     * Lower-case label used in reports.
     *
     * @return label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
