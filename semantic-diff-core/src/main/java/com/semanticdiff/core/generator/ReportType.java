package com.semanticdiff.core.generator;

/**
 * Views a {@link ReportGenerator} can produce.
 */
public enum ReportType {
    /** Structural diff grouped into added, removed and modified changes */
    CHANGELOG,

    /** Structural diff as a line-oriented unified diff */
    UNIFIED_DIFF,

    /** Outcome of a three-way merge */
    MERGE_SUMMARY,

    /** Cross-model semantic debt analysis */
    SEMANTIC_DEBT
}
