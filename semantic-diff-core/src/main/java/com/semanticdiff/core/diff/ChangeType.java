package com.semanticdiff.core.diff;

/**
 * Kind of change between two model versions.
 */
public enum ChangeType {
    /** Element exists only in the target */
    ADDED,

    /** Element exists only in the source */
    REMOVED,

    /** Element exists on both sides with a differing field */
    MODIFIED;

    /**
     * Lower-case label used in reports.
     *
     * @return label
     */
    public String label() {
        return name().toLowerCase();
    }
}
