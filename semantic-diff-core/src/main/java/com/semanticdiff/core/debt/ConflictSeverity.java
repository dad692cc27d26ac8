package com.semanticdiff.core.debt;

import java.util.Locale;

/**
 * Risk level of a semantic conflict.
 */
public enum ConflictSeverity {
    /** Incompatible definitions that will produce inconsistent results */
    CRITICAL,

    /** Partial differences that need review */
    WARNING,

    /** Minor differences */
    INFO;

    /**
     * Lower-case label used in reports.
     *
     * @return label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
