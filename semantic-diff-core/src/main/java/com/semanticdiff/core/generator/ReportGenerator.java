package com.semanticdiff.core.generator;

import com.semanticdiff.core.debt.SemanticDebtReport;
import com.semanticdiff.core.diff.DiffReport;
import com.semanticdiff.core.merge.MergeResult;

import java.util.Set;

/**
 * Interface for generators that turn analysis results into a textual format.
 *
 * <p>Each engine produces a plain result object ({@link DiffReport}, {@link MergeResult},
 * {@link SemanticDebtReport}); generators render those results as Markdown, JSON and so on.
 * A generator supports one or more {@link ReportType}s and rejects the others.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI), see
 * {@link ReportGenerators}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.semanticdiff.core.generator.ReportGenerator}
 *
 * @see ReportType
 * @see GeneratedReport
 */
public interface ReportGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration and on the command
     * line. Should be lowercase (e.g., "markdown", "json").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated reports.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of report types this generator can produce.
     *
     * @return supported report types
     */
    Set<ReportType> getSupportedReportTypes();

    /**
     * Generates a report for a structural diff.
     *
     * @param report diff to render
     * @param type {@link ReportType#CHANGELOG} or {@link ReportType#UNIFIED_DIFF}
     * @return generated report
     * @throws IllegalArgumentException if the type is not supported for diffs
     */
    GeneratedReport generate(DiffReport report, ReportType type);

    /**
     * Generates a report for a merge result.
     *
     * @param result merge result to render
     * @param type {@link ReportType#MERGE_SUMMARY}
     * @return generated report
     * @throws IllegalArgumentException if the type is not supported for merge results
     */
    GeneratedReport generate(MergeResult result, ReportType type);

    /**
     * Generates a report for a semantic debt analysis.
     *
     * @param report debt report to render
     * @param type {@link ReportType#SEMANTIC_DEBT}
     * @return generated report
     * @throws IllegalArgumentException if the type is not supported for debt reports
     */
    GeneratedReport generate(SemanticDebtReport report, ReportType type);
}
