package com.semanticdiff.core.generator.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semanticdiff.core.debt.ConflictKind;
import com.semanticdiff.core.debt.ConflictSeverity;
import com.semanticdiff.core.debt.SemanticConflict;
import com.semanticdiff.core.debt.SemanticDebtReport;
import com.semanticdiff.core.diff.Change;
import com.semanticdiff.core.diff.ChangeType;
import com.semanticdiff.core.diff.DiffReport;
import com.semanticdiff.core.diff.DiffSummary;
import com.semanticdiff.core.generator.GeneratedReport;
import com.semanticdiff.core.generator.ReportGenerator;
import com.semanticdiff.core.generator.ReportType;
import com.semanticdiff.core.merge.MergeConflict;
import com.semanticdiff.core.merge.MergeResult;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.util.LineDiff;

/**
 * Generates human-readable reports in Markdown (and plain unified-diff text).
 *
 * <h2>Report Types</h2>
 * <ul>
 *   <li><b>Changelog:</b> summary counts and the changes grouped into Added, Removed and
 *       Modified sections, with Was/Now lines for modifications</li>
 *   <li><b>Unified diff:</b> one synthetic line {@code "element: path = value"} per change
 *       value, sorted, then diffed like {@code git diff}</li>
 *   <li><b>Merge summary:</b> merged model identity and a conflict table</li>
 *   <li><b>Semantic debt:</b> severity counts, conflicts per severity and numbered
 *       recommendations</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DiffReport diff = new StructuralDiffEngine().diff(v1, v2);
 * GeneratedReport changelog = new MarkdownReportGenerator().generate(diff, ReportType.CHANGELOG);
 * }</pre>
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H3 = "### ";
    private static final String BOLD = "**";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String BULLET = "- ";
    private static final String SUB_BULLET = "  - ";
    private static final String NEWLINE = "\n";

    // Changelog
    private static final String CHANGELOG_TITLE = "Changelog: ";
    private static final String ARROW = " → ";
    private static final String FROM_LABEL = "**From**: ";
    private static final String TO_LABEL = "**To**: ";
    private static final String SUMMARY = "## Summary";
    private static final String TOTAL_CHANGES = "- Total changes: ";
    private static final String ADDED_COUNT = "- ➕ Added: ";
    private static final String REMOVED_COUNT = "- ➖ Removed: ";
    private static final String MODIFIED_COUNT = "- 📝 Modified: ";
    private static final String ADDED_SECTION = "## ➕ Added";
    private static final String REMOVED_SECTION = "## ➖ Removed";
    private static final String MODIFIED_SECTION = "## 📝 Modified";
    private static final String WAS_LABEL = "  - Was: `";
    private static final String NOW_LABEL = "  - Now: `";
    private static final String VERSION_PREFIX = " v";

    // Merge summary
    private static final String MERGE_TITLE = "# Merge Summary: ";
    private static final String STRATEGY_LABEL = "**Strategy**: ";
    private static final String MERGED_FROM_LABEL = "**Merged from**: ";
    private static final String CONFLICTS = "## Conflicts";
    private static final String NO_CONFLICTS = "No conflicts detected.";
    private static final String CONFLICT_TABLE_HEADER = "| Path | Element | Ours | Theirs | Resolution |";
    private static final String CONFLICT_TABLE_SEPARATOR = "|------|---------|------|--------|------------|";

    // Semantic debt
    private static final String DEBT_TITLE = "# Semantic Debt Analysis Report";
    private static final String MODELS_ANALYZED = "- **Ontologies analyzed:** ";
    private static final String TOTAL_CONFLICTS = "- **Total conflicts:** ";
    private static final String CRITICAL_COUNT = "  - 🔴 Critical: ";
    private static final String WARNING_COUNT = "  - 🟡 Warning: ";
    private static final String INFO_COUNT = "  - 🔵 Info: ";
    private static final String BY_TYPE = "### Conflicts by Type";
    private static final String CRITICAL_SECTION = "## 🔴 Critical Conflicts";
    private static final String WARNING_SECTION = "## 🟡 Warnings";
    private static final String INFO_SECTION = "## 🔵 Info";
    private static final String RECOMMENDATIONS = "## Recommendations";
    private static final String TYPE_LABEL = "**Type:** ";
    private static final String DESCRIPTION_LABEL = "**Description:** ";
    private static final String SOURCES_LABEL = "**Sources:**";
    private static final String RECOMMENDATION_LABEL = "**Recommendation:** ";
    private static final String DASH_VALUE = "-";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Report Generator";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(
            ReportType.CHANGELOG,
            ReportType.UNIFIED_DIFF,
            ReportType.MERGE_SUMMARY,
            ReportType.SEMANTIC_DEBT
        );
    }

    @Override
    public GeneratedReport generate(DiffReport report, ReportType type) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(type, "type must not be null");
        log.debug("Generating {} for {} → {}", type, report.sourceName(), report.targetName());

        return switch (type) {
            case CHANGELOG -> new GeneratedReport("changelog", generateChangelog(report), "md");
            case UNIFIED_DIFF -> new GeneratedReport("unified-diff", generateUnifiedDiff(report), "diff");
            default -> throw new IllegalArgumentException("Unsupported report type: " + type);
        };
    }

    @Override
    public GeneratedReport generate(MergeResult result, ReportType type) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (type != ReportType.MERGE_SUMMARY) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }
        log.debug("Generating merge summary for {}", result.merged().name());
        return new GeneratedReport("merge-summary", generateMergeSummary(result), getFileExtension());
    }

    @Override
    public GeneratedReport generate(SemanticDebtReport report, ReportType type) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (type != ReportType.SEMANTIC_DEBT) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }
        log.debug("Generating semantic debt report for {} models", report.modelsAnalyzed().size());
        return new GeneratedReport("semantic-debt", generateSemanticDebt(report), getFileExtension());
    }

    private String generateChangelog(DiffReport report) {
        DiffSummary summary = report.summary();
        List<String> lines = new ArrayList<>();

        lines.add(H1 + CHANGELOG_TITLE + report.sourceName() + ARROW + report.targetName());
        lines.add("");
        lines.add(FROM_LABEL + report.sourceName() + VERSION_PREFIX + report.sourceVersion());
        lines.add(TO_LABEL + report.targetName() + VERSION_PREFIX + report.targetVersion());
        lines.add("");
        lines.add(SUMMARY);
        lines.add("");
        lines.add(TOTAL_CHANGES + summary.totalChanges());
        lines.add(ADDED_COUNT + summary.added());
        lines.add(REMOVED_COUNT + summary.removed());
        lines.add(MODIFIED_COUNT + summary.modified());
        lines.add("");

        appendChangeSection(lines, ADDED_SECTION, report.changesOf(ChangeType.ADDED));
        appendChangeSection(lines, REMOVED_SECTION, report.changesOf(ChangeType.REMOVED));
        appendChangeSection(lines, MODIFIED_SECTION, report.changesOf(ChangeType.MODIFIED));

        return String.join(NEWLINE, lines);
    }

    private void appendChangeSection(List<String> lines, String header, List<Change> changes) {
        if (changes.isEmpty()) {
            return;
        }
        lines.add(header);
        lines.add("");
        for (Change change : changes) {
            lines.add(BULLET + BOLD + change.elementType().label() + BOLD + ": " + CODE + change.path() + CODE);
            if (change.changeType() == ChangeType.MODIFIED
                && hasText(change.oldValue()) && hasText(change.newValue())) {
                lines.add(WAS_LABEL + change.oldValue() + CODE);
                lines.add(NOW_LABEL + change.newValue() + CODE);
            }
            if (hasText(change.details())) {
                lines.add(SUB_BULLET + change.details());
            }
        }
        lines.add("");
    }

    private String generateUnifiedDiff(DiffReport report) {
        List<String> sourceLines = new ArrayList<>();
        List<String> targetLines = new ArrayList<>();
        for (Change change : report.changes()) {
            String prefix = change.elementType().label() + ": " + change.path() + " = ";
            if (hasText(change.oldValue())) {
                sourceLines.add(prefix + change.oldValue());
            }
            if (hasText(change.newValue())) {
                targetLines.add(prefix + change.newValue());
            }
        }
        Collections.sort(sourceLines);
        Collections.sort(targetLines);

        return LineDiff.unified(
            sourceLines,
            targetLines,
            report.sourceName() + VERSION_PREFIX + report.sourceVersion(),
            report.targetName() + VERSION_PREFIX + report.targetVersion(),
            LineDiff.DEFAULT_CONTEXT);
    }

    private String generateMergeSummary(MergeResult result) {
        Ontology merged = result.merged();
        StringBuilder sb = new StringBuilder();

        sb.append(MERGE_TITLE).append(merged.name()).append(VERSION_PREFIX).append(merged.version()).append(NEWLINE);
        sb.append(NEWLINE);
        sb.append(STRATEGY_LABEL).append(result.strategy().label()).append(NEWLINE);
        String mergedFrom = merged.metadata().get("merged_from");
        if (mergedFrom != null) {
            sb.append(MERGED_FROM_LABEL).append(mergedFrom).append(NEWLINE);
        }
        sb.append(NEWLINE);
        sb.append(BULLET).append("Entities: ").append(merged.entities().size()).append(NEWLINE);
        sb.append(BULLET).append("Relationships: ").append(merged.relationships().size()).append(NEWLINE);
        sb.append(BULLET).append("Business rules: ").append(merged.businessRules().size()).append(NEWLINE);
        sb.append(NEWLINE);

        sb.append(CONFLICTS).append(NEWLINE).append(NEWLINE);
        if (!result.hasConflicts()) {
            sb.append(NO_CONFLICTS).append(NEWLINE);
            return sb.toString();
        }

        sb.append(CONFLICT_TABLE_HEADER).append(NEWLINE);
        sb.append(CONFLICT_TABLE_SEPARATOR).append(NEWLINE);
        for (MergeConflict conflict : result.conflicts()) {
            sb.append(PIPE).append(" ").append(CODE).append(escape(conflict.path())).append(CODE).append(" ");
            sb.append(PIPE).append(" ").append(conflict.elementType().label()).append(" ");
            sb.append(PIPE).append(" ").append(describe(conflict.ourChange())).append(" ");
            sb.append(PIPE).append(" ").append(describe(conflict.theirChange())).append(" ");
            sb.append(PIPE).append(" ").append(conflict.resolution().label()).append(" ");
            sb.append(PIPE).append(NEWLINE);
        }
        return sb.toString();
    }

    private String describe(Change change) {
        if (change == null) {
            return DASH_VALUE;
        }
        String value = change.changeType() == ChangeType.REMOVED ? change.oldValue() : change.newValue();
        if (!hasText(value)) {
            return change.changeType().label();
        }
        return change.changeType().label() + " " + CODE + escape(value) + CODE;
    }

    private String generateSemanticDebt(SemanticDebtReport report) {
        Map<ConflictSeverity, Integer> bySeverity = report.countBySeverity();
        List<String> lines = new ArrayList<>();

        lines.add(DEBT_TITLE);
        lines.add("");
        lines.add(SUMMARY);
        lines.add("");
        lines.add(MODELS_ANALYZED + report.modelsAnalyzed().size());
        lines.add(TOTAL_CONFLICTS + report.conflicts().size());
        lines.add(CRITICAL_COUNT + bySeverity.get(ConflictSeverity.CRITICAL));
        lines.add(WARNING_COUNT + bySeverity.get(ConflictSeverity.WARNING));
        lines.add(INFO_COUNT + bySeverity.get(ConflictSeverity.INFO));
        lines.add("");

        Map<ConflictKind, Integer> byKind = report.countByKind();
        if (!byKind.isEmpty()) {
            lines.add(BY_TYPE);
            lines.add("");
            byKind.forEach((kind, count) -> lines.add(BULLET + kind.label() + ": " + count));
            lines.add("");
        }

        appendConflictSection(lines, CRITICAL_SECTION, report.conflictsOf(ConflictSeverity.CRITICAL));
        appendConflictSection(lines, WARNING_SECTION, report.conflictsOf(ConflictSeverity.WARNING));
        appendConflictSection(lines, INFO_SECTION, report.conflictsOf(ConflictSeverity.INFO));

        if (!report.recommendations().isEmpty()) {
            lines.add(RECOMMENDATIONS);
            lines.add("");
            for (int i = 0; i < report.recommendations().size(); i++) {
                lines.add((i + 1) + ". " + report.recommendations().get(i));
            }
            lines.add("");
        }

        return String.join(NEWLINE, lines);
    }

    private void appendConflictSection(List<String> lines, String header, List<SemanticConflict> conflicts) {
        if (conflicts.isEmpty()) {
            return;
        }
        lines.add(header);
        lines.add("");
        for (SemanticConflict conflict : conflicts) {
            lines.add(H3 + conflict.name());
            lines.add("");
            lines.add(TYPE_LABEL + conflict.kind().label());
            lines.add("");
            lines.add(DESCRIPTION_LABEL + conflict.description());
            lines.add("");
            lines.add(SOURCES_LABEL);
            lines.add("");
            conflict.details().forEach((source, detail) ->
                lines.add(BULLET + CODE + source + CODE + ": " + detail));
            lines.add("");
            if (hasText(conflict.recommendation())) {
                lines.add(RECOMMENDATION_LABEL + conflict.recommendation());
                lines.add("");
            }
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * Escapes Markdown table special characters.
     */
    private static String escape(String text) {
        return text.replace(PIPE, "\\|").replace(NEWLINE, " ");
    }
}
