package com.semanticdiff.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.semanticdiff.core.debt.AnalyzerSettings;
import com.semanticdiff.core.debt.RuleComparisonMode;
import com.semanticdiff.core.io.DuplicateNamePolicy;
import com.semanticdiff.core.merge.MergeEngine;
import com.semanticdiff.core.merge.MergeStrategy;

/**
 * Root configuration, loaded from {@code semanticdiff.yaml}.
 *
 * <p>Missing sections and missing keys fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analyzer:
 *   similarityThreshold: 0.8
 *   ruleComparison: PAIRWISE
 *
 * merge:
 *   defaultStrategy: OURS
 *   applyStrategy: true
 *
 * model:
 *   duplicateNames: LAST_WINS
 *
 * output:
 *   directory: "./reports"
 *   format: markdown
 * }</pre>
 *
 * @param analyzer cross-model analysis settings
 * @param merge three-way merge settings
 * @param model model loading settings
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SemanticDiffConfig(
    @JsonProperty("analyzer") AnalyzerConfig analyzer,
    @JsonProperty("merge") MergeConfig merge,
    @JsonProperty("model") ModelConfig model,
    @JsonProperty("output") OutputConfig output
) {
    public SemanticDiffConfig {
        analyzer = analyzer == null ? AnalyzerConfig.defaults() : analyzer;
        merge = merge == null ? MergeConfig.defaults() : merge;
        model = model == null ? ModelConfig.defaults() : model;
        output = output == null ? OutputConfig.defaults() : output;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SemanticDiffConfig defaults() {
        return new SemanticDiffConfig(null, null, null, null);
    }

    /**
     * Cross-model analysis settings.
     *
     * @param similarityThreshold business-rule similarity threshold, 0..1
     * @param ruleComparison which model pairs are compared for rules
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalyzerConfig(
        @JsonProperty("similarityThreshold") Double similarityThreshold,
        @JsonProperty("ruleComparison") RuleComparisonMode ruleComparison
    ) {
        public AnalyzerConfig {
            similarityThreshold = similarityThreshold == null
                ? AnalyzerSettings.DEFAULT_SIMILARITY_THRESHOLD
                : similarityThreshold;
            ruleComparison = ruleComparison == null ? RuleComparisonMode.PAIRWISE : ruleComparison;
        }

        public static AnalyzerConfig defaults() {
            return new AnalyzerConfig(null, null);
        }

        /**
         * Converts to analyzer settings.
         *
         * @return analyzer settings
         * @throws IllegalArgumentException if the threshold is outside 0..1
         */
        public AnalyzerSettings toSettings() {
            return new AnalyzerSettings(similarityThreshold, ruleComparison);
        }
    }

    /**
     * Three-way merge settings.
     *
     * @param defaultStrategy strategy used when none is given
     * @param applyStrategy false to only label conflicts and keep "ours"
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MergeConfig(
        @JsonProperty("defaultStrategy") MergeStrategy defaultStrategy,
        @JsonProperty("applyStrategy") Boolean applyStrategy
    ) {
        public MergeConfig {
            defaultStrategy = defaultStrategy == null ? MergeStrategy.OURS : defaultStrategy;
            applyStrategy = applyStrategy == null ? Boolean.TRUE : applyStrategy;
        }

        public static MergeConfig defaults() {
            return new MergeConfig(null, null);
        }

        /**
         * Creates a merge engine with these settings.
         *
         * @return merge engine
         */
        public MergeEngine createEngine() {
            return new MergeEngine(applyStrategy);
        }
    }

    /**
     * Model loading settings.
     *
     * @param duplicateNames how duplicate names within a model are handled
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelConfig(
        @JsonProperty("duplicateNames") DuplicateNamePolicy duplicateNames
    ) {
        public ModelConfig {
            duplicateNames = duplicateNames == null ? DuplicateNamePolicy.LAST_WINS : duplicateNames;
        }

        public static ModelConfig defaults() {
            return new ModelConfig(null);
        }
    }

    /**
     * Report output settings.
     *
     * @param directory directory that relative report files ({@code -o}) are resolved against
     * @param format default report format id ({@code markdown} or {@code json})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("format") String format
    ) {
        public OutputConfig {
            directory = directory == null ? "./reports" : directory;
            format = format == null ? "markdown" : format;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }
}
