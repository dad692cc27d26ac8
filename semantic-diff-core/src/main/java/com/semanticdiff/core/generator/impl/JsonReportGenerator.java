package com.semanticdiff.core.generator.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semanticdiff.core.debt.SemanticConflict;
import com.semanticdiff.core.debt.SemanticDebtReport;
import com.semanticdiff.core.diff.Change;
import com.semanticdiff.core.diff.DiffReport;
import com.semanticdiff.core.diff.DiffSummary;
import com.semanticdiff.core.generator.GeneratedReport;
import com.semanticdiff.core.generator.ReportGenerator;
import com.semanticdiff.core.generator.ReportType;
import com.semanticdiff.core.io.OntologyWriter;
import com.semanticdiff.core.merge.MergeConflict;
import com.semanticdiff.core.merge.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Set;

/**
 * Generates machine-readable JSON reports.
 *
 * <p>Field names are snake_case and enum values lowercase, e.g. a change is written as
 * {@code {"change_type": "modified", "element_type": "property", "path": "Customer.Email.data_type", ...}}.
 * Merge summaries embed the merged model in the same format {@link OntologyWriter} produces.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OntologyWriter ontologyWriter = new OntologyWriter();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Report Generator";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(ReportType.CHANGELOG, ReportType.MERGE_SUMMARY, ReportType.SEMANTIC_DEBT);
    }

    @Override
    public GeneratedReport generate(DiffReport report, ReportType type) {
        Objects.requireNonNull(report, "report must not be null");
        requireType(type, ReportType.CHANGELOG);
        log.debug("Generating JSON diff for {} → {}", report.sourceName(), report.targetName());

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode source = root.putObject("source");
        source.put("name", report.sourceName());
        source.put("version", report.sourceVersion());
        ObjectNode target = root.putObject("target");
        target.put("name", report.targetName());
        target.put("version", report.targetVersion());

        DiffSummary summary = report.summary();
        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("total_changes", summary.totalChanges());
        summaryNode.put("added", summary.added());
        summaryNode.put("removed", summary.removed());
        summaryNode.put("modified", summary.modified());
        ObjectNode byElement = summaryNode.putObject("by_element");
        summary.byElement().forEach((element, count) -> byElement.put(element.label(), count));

        ArrayNode changes = root.putArray("changes");
        report.changes().forEach(change -> writeChange(changes.addObject(), change));

        return new GeneratedReport("diff", write(root), getFileExtension());
    }

    @Override
    public GeneratedReport generate(MergeResult result, ReportType type) {
        Objects.requireNonNull(result, "result must not be null");
        requireType(type, ReportType.MERGE_SUMMARY);
        log.debug("Generating JSON merge summary for {}", result.merged().name());

        ObjectNode root = objectMapper.createObjectNode();
        root.put("strategy", result.strategy().label());
        root.set("merged", ontologyWriter.toJson(result.merged()));
        ArrayNode conflicts = root.putArray("conflicts");
        for (MergeConflict conflict : result.conflicts()) {
            ObjectNode node = conflicts.addObject();
            node.put("path", conflict.path());
            node.put("element_type", conflict.elementType().label());
            node.put("resolution", conflict.resolution().label());
            if (conflict.ourChange() != null) {
                writeChange(node.putObject("ours"), conflict.ourChange());
            }
            if (conflict.theirChange() != null) {
                writeChange(node.putObject("theirs"), conflict.theirChange());
            }
        }

        return new GeneratedReport("merge-summary", write(root), getFileExtension());
    }

    @Override
    public GeneratedReport generate(SemanticDebtReport report, ReportType type) {
        Objects.requireNonNull(report, "report must not be null");
        requireType(type, ReportType.SEMANTIC_DEBT);
        log.debug("Generating JSON semantic debt report for {} models", report.modelsAnalyzed().size());

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode analyzed = root.putArray("ontologies_analyzed");
        report.modelsAnalyzed().forEach(analyzed::add);

        ObjectNode summary = root.putObject("summary");
        summary.put("total_conflicts", report.conflicts().size());
        report.countBySeverity().forEach((severity, count) -> summary.put(severity.label(), count));
        ObjectNode byType = summary.putObject("by_type");
        report.countByKind().forEach((kind, count) -> byType.put(kind.label(), count));

        ArrayNode conflicts = root.putArray("conflicts");
        for (SemanticConflict conflict : report.conflicts()) {
            ObjectNode node = conflicts.addObject();
            node.put("conflict_type", conflict.kind().label());
            node.put("severity", conflict.severity().label());
            node.put("name", conflict.name());
            ArrayNode sources = node.putArray("sources");
            conflict.sources().forEach(sources::add);
            ObjectNode details = node.putObject("details");
            conflict.details().forEach(details::put);
            node.put("description", conflict.description());
            node.put("recommendation", conflict.recommendation());
        }

        ArrayNode recommendations = root.putArray("recommendations");
        report.recommendations().forEach(recommendations::add);

        return new GeneratedReport("semantic-debt", write(root), getFileExtension());
    }

    private void writeChange(ObjectNode node, Change change) {
        node.put("change_type", change.changeType().label());
        node.put("element_type", change.elementType().label());
        node.put("element_name", change.elementName());
        node.put("path", change.path());
        node.put("old_value", change.oldValue());
        node.put("new_value", change.newValue());
        node.put("details", change.details());
    }

    private void requireType(ReportType type, ReportType expected) {
        Objects.requireNonNull(type, "type must not be null");
        if (type != expected) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }
    }

    private String write(ObjectNode root) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }
}
