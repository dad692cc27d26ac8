package com.semanticdiff.core.debt;

import com.semanticdiff.core.compare.IdentityKeyedComparator;
import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import com.semanticdiff.core.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects conflicting definitions across several independently authored models
 * ("semantic debt").
 *
 * <p>Elements are matched across models by identity key. For every key shared
 * by at least two models the analyzer looks for four kinds of disagreement:
 *
 * <table>
 *   <caption>Conflict kinds</caption>
 *   <tr><th>Kind</th><th>Key</th><th>Trigger</th><th>Severity</th></tr>
 *   <tr><td>{@link ConflictKind#ENTITY_STRUCTURE}</td><td>entity name</td>
 *       <td>property names differ between two models</td>
 *       <td>overlap &lt; 0.5 CRITICAL, &lt; 0.8 WARNING, else INFO</td></tr>
 *   <tr><td>{@link ConflictKind#PROPERTY_TYPE}</td><td>entity + property</td>
 *       <td>data types differ</td><td>CRITICAL</td></tr>
 *   <tr><td>{@link ConflictKind#RELATIONSHIP}</td><td>from + to entity</td>
 *       <td>cardinalities differ</td><td>WARNING</td></tr>
 *   <tr><td>{@link ConflictKind#BUSINESS_RULE}</td><td>rule name</td>
 *       <td>conditions differ</td><td>similarity below threshold CRITICAL, else WARNING</td></tr>
 * </table>
 *
 * <p>Entity structure is compared per pair of models, so an entity defined in
 * K models can yield up to K(K-1)/2 conflicts. The other kinds yield at most
 * one conflict per key listing every model involved.
 *
 * <p>Model order follows the iteration order of the map passed to
 * {@link #analyze(Map)}; pass a {@link LinkedHashMap} for stable reports.
 */
public class CrossModelConflictAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CrossModelConflictAnalyzer.class);

    private static final double CRITICAL_OVERLAP = 0.5;
    private static final double WARNING_OVERLAP = 0.8;
    private static final int WARNING_REVIEW_THRESHOLD = 3;

    private final AnalyzerSettings settings;

    /**
     * Creates an analyzer with {@link AnalyzerSettings#defaults()}.
     */
    public CrossModelConflictAnalyzer() {
        this(AnalyzerSettings.defaults());
    }

    /**
     * Creates an analyzer.
     *
     * @param settings analyzer settings
     */
    public CrossModelConflictAnalyzer(AnalyzerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Analyzes a set of models for conflicting definitions.
     *
     * @param models models by name
     * @return semantic debt report
     * @throws InsufficientInputException if fewer than two models are supplied
     */
    public SemanticDebtReport analyze(Map<String, Ontology> models) {
        Objects.requireNonNull(models, "models must not be null");
        if (models.size() < 2) {
            throw new InsufficientInputException(models.size());
        }

        Map<String, Ontology> ordered = new LinkedHashMap<>(models);
        List<SemanticConflict> conflicts = new ArrayList<>();

        analyzeEntityStructure(ordered, conflicts);
        analyzePropertyTypes(ordered, conflicts);
        analyzeRelationships(ordered, conflicts);
        analyzeBusinessRules(ordered, conflicts);

        List<String> recommendations = recommend(conflicts);
        SemanticDebtReport report = new SemanticDebtReport(new ArrayList<>(ordered.keySet()), conflicts, recommendations);

        log.info("Analyzed {} models: {} conflict(s) ({} critical, {} warning, {} info)",
            ordered.size(), conflicts.size(),
            report.count(ConflictSeverity.CRITICAL),
            report.count(ConflictSeverity.WARNING),
            report.count(ConflictSeverity.INFO));
        return report;
    }

    /**
     * Classifies the structural overlap of two property-name sets.
     *
     * @param first property names of the first entity
     * @param second property names of the second entity
     * @return CRITICAL below 0.5 overlap, WARNING below 0.8, INFO otherwise
     */
    static ConflictSeverity structureSeverity(Set<String> first, Set<String> second) {
        Set<String> union = new LinkedHashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return ConflictSeverity.INFO;
        }
        Set<String> intersection = new LinkedHashSet<>(first);
        intersection.retainAll(second);

        double overlap = (double) intersection.size() / union.size();
        if (overlap < CRITICAL_OVERLAP) {
            return ConflictSeverity.CRITICAL;
        }
        if (overlap < WARNING_OVERLAP) {
            return ConflictSeverity.WARNING;
        }
        return ConflictSeverity.INFO;
    }

    private void analyzeEntityStructure(Map<String, Ontology> models, List<SemanticConflict> conflicts) {
        Map<String, Map<String, OntologyEntity>> byName = new LinkedHashMap<>();
        models.forEach((source, model) ->
            IdentityKeyedComparator.index(model.entities(), OntologyEntity::name).forEach((name, entity) ->
                byName.computeIfAbsent(name, key -> new LinkedHashMap<>()).put(source, entity)));

        for (Map.Entry<String, Map<String, OntologyEntity>> entry : byName.entrySet()) {
            String entityName = entry.getKey();
            List<String> sources = new ArrayList<>(entry.getValue().keySet());

            for (int i = 0; i < sources.size(); i++) {
                for (int j = i + 1; j < sources.size(); j++) {
                    String first = sources.get(i);
                    String second = sources.get(j);
                    Set<String> firstProps = propertyNames(entry.getValue().get(first));
                    Set<String> secondProps = propertyNames(entry.getValue().get(second));

                    Set<String> onlyInFirst = new TreeSet<>(firstProps);
                    onlyInFirst.removeAll(secondProps);
                    Set<String> onlyInSecond = new TreeSet<>(secondProps);
                    onlyInSecond.removeAll(firstProps);

                    if (onlyInFirst.isEmpty() && onlyInSecond.isEmpty()) {
                        continue;
                    }

                    Map<String, String> details = new LinkedHashMap<>();
                    details.put(first, "Properties: " + String.join(", ", new TreeSet<>(firstProps)));
                    details.put(second, "Properties: " + String.join(", ", new TreeSet<>(secondProps)));

                    List<String> missing = new ArrayList<>();
                    if (!onlyInFirst.isEmpty()) {
                        missing.add("only in " + first + ": " + String.join(", ", onlyInFirst));
                    }
                    if (!onlyInSecond.isEmpty()) {
                        missing.add("only in " + second + ": " + String.join(", ", onlyInSecond));
                    }

                    conflicts.add(new SemanticConflict(
                        ConflictKind.ENTITY_STRUCTURE,
                        structureSeverity(firstProps, secondProps),
                        entityName,
                        List.of(first, second),
                        details,
                        "Entity '" + entityName + "' has different structures: " + String.join("; ", missing),
                        "Unify entity '" + entityName + "' structure across models or rename it to avoid confusion."
                    ));
                }
            }
        }
    }

    private void analyzePropertyTypes(Map<String, Ontology> models, List<SemanticConflict> conflicts) {
        // (entity, property) -> source -> property
        Map<List<String>, Map<String, OntologyProperty>> byKey = new LinkedHashMap<>();
        models.forEach((source, model) -> {
            for (OntologyEntity entity : IdentityKeyedComparator.index(model.entities(), OntologyEntity::name).values()) {
                IdentityKeyedComparator.index(entity.properties(), OntologyProperty::name).forEach((name, property) ->
                    byKey.computeIfAbsent(List.of(entity.name(), name), key -> new LinkedHashMap<>())
                        .put(source, property));
            }
        });

        for (Map.Entry<List<String>, Map<String, OntologyProperty>> entry : byKey.entrySet()) {
            Map<String, OntologyProperty> sources = entry.getValue();
            if (sources.size() < 2) {
                continue;
            }

            Set<String> types = new LinkedHashSet<>();
            Map<String, String> details = new LinkedHashMap<>();
            sources.forEach((source, property) -> {
                types.add(property.dataType());
                details.put(source, "Type: " + property.dataType());
            });
            if (types.size() < 2) {
                continue;
            }

            String propertyName = entry.getKey().get(1);
            String qualifiedName = entry.getKey().get(0) + "." + propertyName;
            conflicts.add(new SemanticConflict(
                ConflictKind.PROPERTY_TYPE,
                ConflictSeverity.CRITICAL,
                qualifiedName,
                new ArrayList<>(sources.keySet()),
                details,
                "Property '" + qualifiedName + "' has different types: " + String.join(", ", types),
                "Standardize the data type for '" + propertyName + "' across all models."
            ));
        }
    }

    private void analyzeRelationships(Map<String, Ontology> models, List<SemanticConflict> conflicts) {
        Map<String, Map<String, OntologyRelationship>> byKey = new LinkedHashMap<>();
        models.forEach((source, model) ->
            IdentityKeyedComparator.index(model.relationships(), OntologyRelationship::key).forEach((key, relationship) ->
                byKey.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(source, relationship)));

        for (Map<String, OntologyRelationship> sources : byKey.values()) {
            if (sources.size() < 2) {
                continue;
            }

            Set<String> cardinalities = new LinkedHashSet<>();
            Map<String, String> details = new LinkedHashMap<>();
            sources.forEach((source, relationship) -> {
                cardinalities.add(relationship.cardinality());
                details.put(source, "Type: " + relationship.relationshipType()
                    + ", Cardinality: " + relationship.cardinality());
            });
            if (cardinalities.size() < 2) {
                continue;
            }

            OntologyRelationship sample = sources.values().iterator().next();
            String name = sample.fromEntity() + " → " + sample.toEntity();
            conflicts.add(new SemanticConflict(
                ConflictKind.RELATIONSHIP,
                ConflictSeverity.WARNING,
                name,
                new ArrayList<>(sources.keySet()),
                details,
                "Relationship '" + name + "' has different cardinalities: " + String.join(", ", cardinalities),
                "Verify the correct cardinality and update the models accordingly."
            ));
        }
    }

    private void analyzeBusinessRules(Map<String, Ontology> models, List<SemanticConflict> conflicts) {
        Map<String, Map<String, BusinessRule>> byName = new LinkedHashMap<>();
        models.forEach((source, model) ->
            IdentityKeyedComparator.index(model.businessRules(), BusinessRule::name).forEach((name, rule) ->
                byName.computeIfAbsent(name, key -> new LinkedHashMap<>()).put(source, rule)));

        for (Map.Entry<String, Map<String, BusinessRule>> entry : byName.entrySet()) {
            Map<String, BusinessRule> sources = entry.getValue();
            if (sources.size() < 2) {
                continue;
            }

            List<String> conditions = new ArrayList<>(new LinkedHashSet<>(
                sources.values().stream().map(BusinessRule::condition).toList()));
            if (conditions.size() < 2) {
                continue;
            }

            double similarity = conditionSimilarity(conditions);
            ConflictSeverity severity = similarity < settings.similarityThreshold()
                ? ConflictSeverity.CRITICAL
                : ConflictSeverity.WARNING;

            Map<String, String> details = new LinkedHashMap<>();
            sources.forEach((source, rule) ->
                details.put(source, "Condition: " + rule.condition() + ", Action: " + rule.action()));

            String ruleName = entry.getKey();
            conflicts.add(new SemanticConflict(
                ConflictKind.BUSINESS_RULE,
                severity,
                ruleName,
                new ArrayList<>(sources.keySet()),
                details,
                String.format(Locale.ROOT, "Business rule '%s' has different conditions across models (similarity %.2f).",
                    ruleName, similarity),
                "Consolidate rule '" + ruleName + "' into a single source of truth."
            ));
        }
    }

    /**
     * Scores distinct conditions according to the configured {@link RuleComparisonMode}.
     */
    private double conditionSimilarity(List<String> conditions) {
        if (settings.ruleComparison() == RuleComparisonMode.FIRST_TWO) {
            return TextSimilarity.ratio(conditions.get(0), conditions.get(1));
        }
        double lowest = 1.0;
        for (int i = 0; i < conditions.size(); i++) {
            for (int j = i + 1; j < conditions.size(); j++) {
                lowest = Math.min(lowest, TextSimilarity.ratio(conditions.get(i), conditions.get(j)));
            }
        }
        return lowest;
    }

    private static Set<String> propertyNames(OntologyEntity entity) {
        return new LinkedHashSet<>(IdentityKeyedComparator.index(entity.properties(), OntologyProperty::name).keySet());
    }

    private static List<String> recommend(List<SemanticConflict> conflicts) {
        List<String> recommendations = new ArrayList<>();
        if (conflicts.isEmpty()) {
            recommendations.add("No semantic conflicts detected.");
            return recommendations;
        }

        long critical = conflicts.stream().filter(c -> c.severity() == ConflictSeverity.CRITICAL).count();
        long warnings = conflicts.stream().filter(c -> c.severity() == ConflictSeverity.WARNING).count();

        if (critical > 0) {
            recommendations.add("Address " + critical
                + " critical conflict(s) immediately - they may cause data inconsistencies.");
        }
        if (hasKind(conflicts, ConflictKind.PROPERTY_TYPE)) {
            recommendations.add("Create a shared data dictionary to standardize property types across models.");
        }
        if (hasKind(conflicts, ConflictKind.ENTITY_STRUCTURE)) {
            recommendations.add("Consider creating a master ontology schema that all models inherit from.");
        }
        if (hasKind(conflicts, ConflictKind.BUSINESS_RULE)) {
            recommendations.add("Centralize business rules in a single repository to ensure consistency.");
        }
        if (warnings > WARNING_REVIEW_THRESHOLD) {
            recommendations.add("Schedule a semantic alignment review with the teams that own the conflicting models.");
        }
        return recommendations;
    }

    private static boolean hasKind(List<SemanticConflict> conflicts, ConflictKind kind) {
        return conflicts.stream().anyMatch(conflict -> conflict.kind() == kind);
    }
}
