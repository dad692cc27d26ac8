package com.semanticdiff.core.debt;

import java.util.Objects;

/**
 * Tuning of {@link CrossModelConflictAnalyzer}.
 *
 * @param similarityThreshold rule conditions less similar than this are CRITICAL, others WARNING
 * @param ruleComparison how conditions of more than two variants are scored
 */
public record AnalyzerSettings(
    double similarityThreshold,
    RuleComparisonMode ruleComparison
) {
    /** Default similarity threshold. */
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    /**
     * Compact constructor with validation.
     */
    public AnalyzerSettings {
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be between 0 and 1, was " + similarityThreshold);
        }
        Objects.requireNonNull(ruleComparison, "ruleComparison must not be null");
    }

    /**
     * Default settings: threshold 0.8, pairwise rule comparison.
     *
     * @return default settings
     */
    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(DEFAULT_SIMILARITY_THRESHOLD, RuleComparisonMode.PAIRWISE);
    }
}
