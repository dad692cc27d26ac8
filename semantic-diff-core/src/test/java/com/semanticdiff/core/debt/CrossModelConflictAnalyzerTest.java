package com.semanticdiff.core.debt;

import com.semanticdiff.core.model.Ontology;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.semanticdiff.core.TestModels.entity;
import static com.semanticdiff.core.TestModels.ontology;
import static com.semanticdiff.core.TestModels.property;
import static com.semanticdiff.core.TestModels.relationship;
import static com.semanticdiff.core.TestModels.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CrossModelConflictAnalyzer}.
 */
class CrossModelConflictAnalyzerTest {

    private final CrossModelConflictAnalyzer analyzer = new CrossModelConflictAnalyzer();

    @Test
    void analyze_identicalEntities_noConflicts() {
        Map<String, Ontology> models = models(
            "Sales", ontology("Sales", entity("Customer", property("Id", "Integer"), property("Name", "String"))),
            "Finance", ontology("Finance", entity("Customer", property("Id", "Integer"), property("Name", "String"))));

        SemanticDebtReport report = analyzer.analyze(models);

        assertThat(report.hasConflicts()).isFalse();
        assertThat(report.modelsAnalyzed()).containsExactly("Sales", "Finance");
        assertThat(report.recommendations()).containsExactly("No semantic conflicts detected.");
    }

    @Test
    void analyze_differentPropertyTypes_reportsCriticalTypeConflict() {
        // Given
        Map<String, Ontology> models = models(
            "Sales", ontology("Sales", entity("Customer", property("CustomerId", "Integer"))),
            "Finance", ontology("Finance", entity("Customer", property("CustomerId", "String"))));

        // When
        SemanticDebtReport report = analyzer.analyze(models);

        // Then
        assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.kind()).isEqualTo(ConflictKind.PROPERTY_TYPE);
            assertThat(conflict.severity()).isEqualTo(ConflictSeverity.CRITICAL);
            assertThat(conflict.name()).isEqualTo("Customer.CustomerId");
            assertThat(conflict.sources()).containsExactly("Sales", "Finance");
            assertThat(conflict.details())
                .containsEntry("Sales", "Type: Integer")
                .containsEntry("Finance", "Type: String");
        });
        assertThat(report.recommendations()).containsExactly(
            "Address 1 critical conflict(s) immediately - they may cause data inconsistencies.",
            "Create a shared data dictionary to standardize property types across models.");
    }

    @Test
    void analyze_differentCardinalities_reportsRelationshipWarning() {
        Map<String, Ontology> models = models(
            "Sales", ontology("Sales", List.of(), List.of(relationship("Order", "Customer", "many-to-one")), List.of(), Map.of()),
            "Finance", ontology("Finance", List.of(), List.of(relationship("Order", "Customer", "one-to-many")), List.of(), Map.of()));

        SemanticDebtReport report = analyzer.analyze(models);

        assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.kind()).isEqualTo(ConflictKind.RELATIONSHIP);
            assertThat(conflict.severity()).isEqualTo(ConflictSeverity.WARNING);
            assertThat(conflict.name()).isEqualTo("Order → Customer");
            assertThat(conflict.description()).contains("many-to-one", "one-to-many");
        });
    }

    @Test
    void analyze_halfOverlappingProperties_reportsStructureWarning() {
        Map<String, Ontology> models = models(
            "source1", ontology("source1", entity("Customer",
                property("Id", "String"), property("Name", "String"), property("Email", "String"))),
            "source2", ontology("source2", entity("Customer",
                property("Id", "String"), property("Name", "String"), property("CreditLimit", "String"))));

        SemanticDebtReport report = analyzer.analyze(models);

        assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.kind()).isEqualTo(ConflictKind.ENTITY_STRUCTURE);
            assertThat(conflict.severity()).isEqualTo(ConflictSeverity.WARNING);
            assertThat(conflict.description()).isEqualTo(
                "Entity 'Customer' has different structures: only in source1: Email; only in source2: CreditLimit");
            assertThat(conflict.details()).containsEntry("source1", "Properties: Email, Id, Name");
        });
    }

    @Test
    void structureSeverity_bracketsByOverlap() {
        assertThat(CrossModelConflictAnalyzer.structureSeverity(Set.of("a", "b"), Set.of("c", "d")))
            .isEqualTo(ConflictSeverity.CRITICAL);
        assertThat(CrossModelConflictAnalyzer.structureSeverity(Set.of("a", "b", "c"), Set.of("a", "b", "d")))
            .isEqualTo(ConflictSeverity.WARNING);
        assertThat(CrossModelConflictAnalyzer.structureSeverity(
                Set.of("a", "b", "c", "d", "e"), Set.of("a", "b", "c", "d", "e", "f")))
            .isEqualTo(ConflictSeverity.INFO);
    }

    @Test
    void analyze_similarRuleConditions_reportsWarning() {
        Map<String, Ontology> models = models(
            "Sales", ontology("Sales", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 10000")), Map.of()),
            "Finance", ontology("Finance", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 50000")), Map.of()));

        SemanticDebtReport report = analyzer.analyze(models);

        assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.kind()).isEqualTo(ConflictKind.BUSINESS_RULE);
            assertThat(conflict.severity()).isEqualTo(ConflictSeverity.WARNING);
            assertThat(conflict.description()).contains("similarity 0.93");
        });
        assertThat(report.recommendations())
            .contains("Centralize business rules in a single repository to ensure consistency.");
    }

    @Test
    void analyze_dissimilarRuleConditions_reportsCritical() {
        Map<String, Ontology> models = models(
            "Sales", ontology("Sales", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 10000")), Map.of()),
            "Finance", ontology("Finance", List.of(), List.of(), List.of(rule("HighValueOrder", "Status == VIP")), Map.of()));

        SemanticDebtReport report = analyzer.analyze(models);

        assertThat(report.conflicts()).singleElement()
            .extracting(SemanticConflict::severity)
            .isEqualTo(ConflictSeverity.CRITICAL);
    }

    @Test
    void analyze_ruleComparisonMode_decidesWhichConditionsAreScored() {
        Map<String, Ontology> models = new LinkedHashMap<>();
        models.put("A", ontology("A", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 10000")), Map.of()));
        models.put("B", ontology("B", List.of(), List.of(), List.of(rule("HighValueOrder", "Amount > 50000")), Map.of()));
        models.put("C", ontology("C", List.of(), List.of(), List.of(rule("HighValueOrder", "Status == VIP")), Map.of()));

        SemanticDebtReport firstTwo = new CrossModelConflictAnalyzer(
            new AnalyzerSettings(0.8, RuleComparisonMode.FIRST_TWO)).analyze(models);
        SemanticDebtReport pairwise = new CrossModelConflictAnalyzer(
            new AnalyzerSettings(0.8, RuleComparisonMode.PAIRWISE)).analyze(models);

        assertThat(firstTwo.conflicts()).singleElement()
            .extracting(SemanticConflict::severity)
            .isEqualTo(ConflictSeverity.WARNING);
        assertThat(pairwise.conflicts()).singleElement()
            .extracting(SemanticConflict::severity)
            .isEqualTo(ConflictSeverity.CRITICAL);
        assertThat(pairwise.conflicts().get(0).sources()).containsExactly("A", "B", "C");
    }

    @Test
    void analyze_manyWarnings_recommendsAlignmentReview() {
        List<String> targets = List.of("Customer", "Product", "Store", "Region");
        Map<String, Ontology> models = models(
            "Sales", ontology("Sales", List.of(),
                targets.stream().map(to -> relationship("Order", to, "many-to-one")).toList(), List.of(), Map.of()),
            "Finance", ontology("Finance", List.of(),
                targets.stream().map(to -> relationship("Order", to, "one-to-one")).toList(), List.of(), Map.of()));

        SemanticDebtReport report = analyzer.analyze(models);

        assertThat(report.count(ConflictSeverity.WARNING)).isEqualTo(4);
        assertThat(report.recommendations()).containsExactly(
            "Schedule a semantic alignment review with the teams that own the conflicting models.");
    }

    @Test
    void analyze_singleModel_throwsInsufficientInput() {
        Map<String, Ontology> models = Map.of("Sales", ontology("Sales"));

        assertThatThrownBy(() -> analyzer.analyze(models))
            .isInstanceOf(InsufficientInputException.class)
            .hasMessage("At least 2 models are required for cross-model analysis, got 1")
            .satisfies(e -> assertThat(((InsufficientInputException) e).getModelCount()).isEqualTo(1));
    }

    @Test
    void report_countsBySeverityIncludeEverySeverity() {
        SemanticDebtReport report = analyzer.analyze(models(
            "Sales", ontology("Sales", entity("Customer", property("CustomerId", "Integer"))),
            "Finance", ontology("Finance", entity("Customer", property("CustomerId", "String")))));

        assertThat(report.countBySeverity())
            .containsEntry(ConflictSeverity.CRITICAL, 1)
            .containsEntry(ConflictSeverity.WARNING, 0)
            .containsEntry(ConflictSeverity.INFO, 0);
        assertThat(report.countByKind()).containsOnlyKeys(ConflictKind.PROPERTY_TYPE);
    }

    @Test
    void settings_thresholdOutOfRange_throwsException() {
        assertThatThrownBy(() -> new AnalyzerSettings(1.5, RuleComparisonMode.PAIRWISE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("similarityThreshold must be between 0 and 1");
    }

    private static Map<String, Ontology> models(String firstName, Ontology first, String secondName, Ontology second) {
        Map<String, Ontology> models = new LinkedHashMap<>();
        models.put(firstName, first);
        models.put(secondName, second);
        return models;
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, -0.1, 1.5})
    void analyzerSettings_thresholdOutsideUnitRange_throwsException(double threshold) {
        assertThatThrownBy(() -> new AnalyzerSettings(threshold, RuleComparisonMode.PAIRWISE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("similarityThreshold must be between 0 and 1");
    }
}
