package com.semanticdiff.core.diff;

import com.semanticdiff.core.compare.ComparedField;
import com.semanticdiff.core.compare.ComparisonResult;
import com.semanticdiff.core.compare.FieldDifference;
import com.semanticdiff.core.compare.IdentityKeyedComparator;
import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the structural difference between two versions of an ontology.
 *
 * <p>The comparison runs {@link IdentityKeyedComparator} over each collection
 * of the model in a fixed sequence:
 * <ol>
 *   <li>Entities by name: entity type and description, then their properties
 *       by name (data type, required flag, unique flag)</li>
 *   <li>Relationships by {@code From→To} pair: relationship type and cardinality</li>
 *   <li>Business rules by name: condition, action and classification</li>
 *   <li>Metadata by key</li>
 * </ol>
 *
 * <p>The engine is stateless. Every call is a pure function of its arguments,
 * so one instance can be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiffReport report = new StructuralDiffEngine().diff(v1, v2);
 * if (report.hasChanges()) {
 *     report.changesOf(ChangeType.ADDED).forEach(c -> System.out.println(c.path()));
 * }
 * }</pre>
 */
public class StructuralDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(StructuralDiffEngine.class);

    /** Path prefix of business rule changes. */
    public static final String RULE_PREFIX = "rule:";

    /** Path prefix of metadata changes. */
    public static final String METADATA_PREFIX = "metadata:";

    private static final List<ComparedField<OntologyEntity>> ENTITY_FIELDS = List.of(
        ComparedField.of("entity_type", OntologyEntity::entityType),
        ComparedField.of("description", OntologyEntity::description)
    );

    private static final List<ComparedField<OntologyProperty>> PROPERTY_FIELDS = List.of(
        ComparedField.of("data_type", OntologyProperty::dataType),
        ComparedField.of("required", OntologyProperty::required),
        ComparedField.of("unique", OntologyProperty::unique)
    );

    private static final List<ComparedField<OntologyRelationship>> RELATIONSHIP_FIELDS = List.of(
        ComparedField.of("type", OntologyRelationship::relationshipType),
        ComparedField.of("cardinality", OntologyRelationship::cardinality)
    );

    private static final List<ComparedField<BusinessRule>> RULE_FIELDS = List.of(
        ComparedField.of("condition", BusinessRule::condition),
        ComparedField.of("action", BusinessRule::action),
        ComparedField.of("classification", BusinessRule::classification)
    );

    private static final Map<String, String> FIELD_DETAILS = Map.of(
        "entity_type", "Entity type changed",
        "description", "Description updated",
        "data_type", "Data type changed",
        "required", "Required flag changed",
        "unique", "Unique flag changed",
        "type", "Relationship type changed",
        "cardinality", "Cardinality changed",
        "condition", "Condition changed",
        "action", "Action changed",
        "classification", "Classification changed"
    );

    /**
     * Diffs two ontologies.
     *
     * @param source original (old) version
     * @param target updated (new) version
     * @return report listing every change from source to target
     */
    public DiffReport diff(Ontology source, Ontology target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        List<Change> changes = new ArrayList<>();
        diffEntities(source, target, changes);
        diffRelationships(source, target, changes);
        diffBusinessRules(source, target, changes);
        diffMetadata(source, target, changes);

        DiffReport report = new DiffReport(
            source.name(), source.version(), target.name(), target.version(), changes);

        if (log.isDebugEnabled()) {
            DiffSummary summary = report.summary();
            log.debug("Diff {} v{} -> {} v{}: {} added, {} removed, {} modified",
                source.name(), source.version(), target.name(), target.version(),
                summary.added(), summary.removed(), summary.modified());
        }
        return report;
    }

    private void diffEntities(Ontology source, Ontology target, List<Change> changes) {
        Map<String, OntologyEntity> before = IdentityKeyedComparator.index(source.entities(), OntologyEntity::name);
        Map<String, OntologyEntity> after = IdentityKeyedComparator.index(target.entities(), OntologyEntity::name);

        // entity fields are compared per entity below so each entity's own changes precede its properties'
        ComparisonResult<OntologyEntity> result = IdentityKeyedComparator.compare(before, after, List.of());

        result.added().forEach((name, entity) -> changes.add(Change.added(
            ElementType.ENTITY, name, null, name, entitySummary(entity), entity.description())));

        result.removed().forEach((name, entity) -> changes.add(Change.removed(
            ElementType.ENTITY, name, null, name, entitySummary(entity), entity.description())));

        for (String name : result.common()) {
            for (FieldDifference difference : IdentityKeyedComparator.compareFields(
                    name, before.get(name), after.get(name), ENTITY_FIELDS)) {
                changes.add(modified(ElementType.ENTITY, name, null, name, difference));
            }
            diffProperties(name, before.get(name), after.get(name), changes);
        }
    }

    private void diffProperties(String entityName, OntologyEntity source, OntologyEntity target, List<Change> changes) {
        Map<String, OntologyProperty> before = IdentityKeyedComparator.index(source.properties(), OntologyProperty::name);
        Map<String, OntologyProperty> after = IdentityKeyedComparator.index(target.properties(), OntologyProperty::name);

        ComparisonResult<OntologyProperty> result = IdentityKeyedComparator.compare(before, after, PROPERTY_FIELDS);

        result.added().forEach((name, property) -> changes.add(Change.added(
            ElementType.PROPERTY, name, entityName, entityName + "." + name,
            propertySummary(property), property.description())));

        result.removed().forEach((name, property) -> changes.add(Change.removed(
            ElementType.PROPERTY, name, entityName, entityName + "." + name,
            propertySummary(property), property.description())));

        for (FieldDifference difference : result.modified()) {
            changes.add(modified(ElementType.PROPERTY, difference.key(), entityName,
                entityName + "." + difference.key(), difference));
        }
    }

    private void diffRelationships(Ontology source, Ontology target, List<Change> changes) {
        Map<String, OntologyRelationship> before = IdentityKeyedComparator.index(
            source.relationships(), OntologyRelationship::key);
        Map<String, OntologyRelationship> after = IdentityKeyedComparator.index(
            target.relationships(), OntologyRelationship::key);

        ComparisonResult<OntologyRelationship> result =
            IdentityKeyedComparator.compare(before, after, RELATIONSHIP_FIELDS);

        result.added().forEach((key, relationship) -> changes.add(Change.added(
            ElementType.RELATIONSHIP, key, null, key, relationshipSummary(relationship), relationship.description())));

        result.removed().forEach((key, relationship) -> changes.add(Change.removed(
            ElementType.RELATIONSHIP, key, null, key, relationshipSummary(relationship), relationship.description())));

        for (FieldDifference difference : result.modified()) {
            changes.add(modified(ElementType.RELATIONSHIP, difference.key(), null, difference.key(), difference));
        }
    }

    private void diffBusinessRules(Ontology source, Ontology target, List<Change> changes) {
        Map<String, BusinessRule> before = IdentityKeyedComparator.index(source.businessRules(), BusinessRule::name);
        Map<String, BusinessRule> after = IdentityKeyedComparator.index(target.businessRules(), BusinessRule::name);

        ComparisonResult<BusinessRule> result = IdentityKeyedComparator.compare(before, after, RULE_FIELDS);

        result.added().forEach((name, rule) -> changes.add(Change.added(
            ElementType.RULE, name, null, RULE_PREFIX + name, ruleSummary(rule), rule.description())));

        result.removed().forEach((name, rule) -> changes.add(Change.removed(
            ElementType.RULE, name, null, RULE_PREFIX + name, ruleSummary(rule), rule.description())));

        for (FieldDifference difference : result.modified()) {
            changes.add(modified(ElementType.RULE, difference.key(), null, RULE_PREFIX + difference.key(), difference));
        }
    }

    private void diffMetadata(Ontology source, Ontology target, List<Change> changes) {
        ComparisonResult<String> result = IdentityKeyedComparator.compareValues(source.metadata(), target.metadata());

        result.added().forEach((key, value) -> changes.add(Change.added(
            ElementType.METADATA, key, null, METADATA_PREFIX + key, value, "")));

        result.removed().forEach((key, value) -> changes.add(Change.removed(
            ElementType.METADATA, key, null, METADATA_PREFIX + key, value, "")));

        for (FieldDifference difference : result.modified()) {
            changes.add(Change.modified(ElementType.METADATA, difference.key(), null,
                METADATA_PREFIX + difference.key(), difference.oldValue(), difference.newValue(), ""));
        }
    }

    private static Change modified(ElementType elementType, String elementName, String parentName,
                                   String basePath, FieldDifference difference) {
        return Change.modified(
            elementType,
            elementName,
            parentName,
            basePath + "." + difference.field(),
            difference.oldValue(),
            difference.newValue(),
            FIELD_DETAILS.getOrDefault(difference.field(), ""));
    }

    private static String entitySummary(OntologyEntity entity) {
        return "type=" + entity.entityType() + ", properties=" + entity.properties().size();
    }

    private static String propertySummary(OntologyProperty property) {
        return "type=" + property.dataType() + ", required=" + property.required();
    }

    private static String relationshipSummary(OntologyRelationship relationship) {
        return "type=" + relationship.relationshipType() + ", cardinality=" + relationship.cardinality();
    }

    private static String ruleSummary(BusinessRule rule) {
        return "condition=" + rule.condition() + ", action=" + rule.action();
    }
}
