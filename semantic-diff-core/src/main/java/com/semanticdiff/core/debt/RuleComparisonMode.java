package com.semanticdiff.core.debt;

/**
 * How differing business-rule conditions are scored when more than two
 * variants of a rule exist.
 */
public enum RuleComparisonMode {
    /** Score only the first two distinct conditions, in model order */
    FIRST_TWO,

    /** Score every pair of distinct conditions and keep the lowest similarity */
    PAIRWISE
}
