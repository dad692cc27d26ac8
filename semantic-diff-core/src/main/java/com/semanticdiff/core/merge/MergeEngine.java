package com.semanticdiff.core.merge;

import com.semanticdiff.core.compare.IdentityKeyedComparator;
import com.semanticdiff.core.diff.Change;
import com.semanticdiff.core.diff.ChangeType;
import com.semanticdiff.core.diff.DiffReport;
import com.semanticdiff.core.diff.ElementType;
import com.semanticdiff.core.diff.StructuralDiffEngine;
import com.semanticdiff.core.model.BusinessRule;
import com.semanticdiff.core.model.Ontology;
import com.semanticdiff.core.model.OntologyEntity;
import com.semanticdiff.core.model.OntologyProperty;
import com.semanticdiff.core.model.OntologyRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Three-way merge of two divergent edits of a common base ontology.
 *
 * <p>The merge diffs both sides against the base and treats every path that
 * appears in both diffs as a conflict. The merged model starts from "ours";
 * additions made only by "theirs" are copied in. For conflicting paths the
 * {@link MergeStrategy} decides which value survives:
 * <ul>
 *   <li>{@link MergeStrategy#OURS} keeps our value</li>
 *   <li>{@link MergeStrategy#THEIRS} takes their value, or their removal</li>
 *   <li>{@link MergeStrategy#UNION} merges the property lists of an entity added
 *       on both sides and keeps our value everywhere else</li>
 * </ul>
 *
 * <p>With {@code applyStrategy = false} the strategy is only recorded on each
 * conflict and our value is always kept.
 *
 * <p>Modifications and removals made only by "theirs" are not propagated;
 * only their additions are.
 *
 * <p><b>Version:</b> the merged version is our version with its last numeric
 * component incremented ({@code "1.2"} becomes {@code "1.3"}); a single-component
 * or non-numeric version gets {@code ".1"} appended.
 */
public class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    /** Metadata key recording the names of the merged models. */
    public static final String MERGED_FROM_KEY = "merged_from";

    private final StructuralDiffEngine diffEngine;
    private final boolean applyStrategy;

    /**
     * Creates a merge engine that applies the chosen strategy.
     */
    public MergeEngine() {
        this(new StructuralDiffEngine(), true);
    }

    /**
     * Creates a merge engine.
     *
     * @param applyStrategy whether conflicting paths are resolved by the strategy
     *                      ({@code false} keeps our value and only labels the conflict)
     */
    public MergeEngine(boolean applyStrategy) {
        this(new StructuralDiffEngine(), applyStrategy);
    }

    /**
     * Creates a merge engine with an explicit diff engine.
     *
     * @param diffEngine diff engine used for base-to-side comparisons
     * @param applyStrategy whether conflicting paths are resolved by the strategy
     */
    public MergeEngine(StructuralDiffEngine diffEngine, boolean applyStrategy) {
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine must not be null");
        this.applyStrategy = applyStrategy;
    }

    /**
     * Merges with the {@link MergeStrategy#OURS} strategy.
     *
     * @param base common ancestor
     * @param ours our version
     * @param theirs their version
     * @return merged model and conflicts
     */
    public MergeResult merge(Ontology base, Ontology ours, Ontology theirs) {
        return merge(base, ours, theirs, MergeStrategy.OURS);
    }

    /**
     * Performs a three-way merge.
     *
     * @param base common ancestor
     * @param ours our version
     * @param theirs their version
     * @param strategy conflict resolution strategy
     * @return merged model and conflicts
     */
    public MergeResult merge(Ontology base, Ontology ours, Ontology theirs, MergeStrategy strategy) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(ours, "ours must not be null");
        Objects.requireNonNull(theirs, "theirs must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");

        DiffReport ourDiff = diffEngine.diff(base, ours);
        DiffReport theirDiff = diffEngine.diff(base, theirs);

        Map<String, Change> ourChanges = new LinkedHashMap<>();
        for (Change change : ourDiff.changes()) {
            ourChanges.put(change.path(), change);
        }

        MergeState state = new MergeState(ours, theirs);
        List<MergeConflict> conflicts = new ArrayList<>();

        for (Change theirChange : theirDiff.changes()) {
            Change ourChange = ourChanges.get(theirChange.path());
            if (ourChange != null) {
                log.debug("Conflict at {} ({} vs {})", theirChange.path(),
                    ourChange.changeType(), theirChange.changeType());
                conflicts.add(new MergeConflict(
                    theirChange.path(), theirChange.elementType(), strategy, ourChange, theirChange));
                if (applyStrategy) {
                    state.resolve(theirChange, strategy);
                }
            } else if (theirChange.changeType() == ChangeType.ADDED) {
                state.incorporate(theirChange);
            }
        }

        Ontology merged = new Ontology(
            ours.name(),
            incrementVersion(ours.version()),
            ours.source(),
            new ArrayList<>(state.entities.values()),
            new ArrayList<>(state.relationships.values()),
            new ArrayList<>(state.rules.values()),
            mergeMetadata(base, ours, theirs, state.metadataOverrides)
        );

        log.info("Merged {} and {} onto {}: {} conflict(s), strategy {}",
            ours.name(), theirs.name(), base.name(), conflicts.size(), strategy.label());
        return new MergeResult(merged, conflicts, strategy);
    }

    /**
     * Increments the last dot-separated component of a version string.
     *
     * @param version version to increment
     * @return incremented version, or {@code version + ".1"} when there is no
     *         numeric last component to increment
     */
    public static String incrementVersion(String version) {
        String[] parts = version.split("\\.", -1);
        if (parts.length >= 2) {
            try {
                parts[parts.length - 1] = String.valueOf(Integer.parseInt(parts[parts.length - 1]) + 1);
                return String.join(".", parts);
            } catch (NumberFormatException e) {
                log.debug("Version {} has a non-numeric last component", version);
            }
        }
        return version + ".1";
    }

    private static Map<String, String> mergeMetadata(
        Ontology base, Ontology ours, Ontology theirs, Map<String, String> overrides
    ) {
        Map<String, String> metadata = new LinkedHashMap<>(base.metadata());
        metadata.putAll(theirs.metadata());
        metadata.putAll(ours.metadata());
        overrides.forEach((key, value) -> {
            if (value == null) {
                metadata.remove(key);
            } else {
                metadata.put(key, value);
            }
        });
        metadata.put(MERGED_FROM_KEY, List.of(ours.name(), theirs.name()).toString());
        return metadata;
    }

    /**
     * Mutable working copy of the merged collections, seeded from "ours".
     */
    private static final class MergeState {

        private final Map<String, OntologyEntity> entities;
        private final Map<String, OntologyRelationship> relationships;
        private final Map<String, BusinessRule> rules;
        private final Map<String, String> metadataOverrides = new LinkedHashMap<>();

        private final Ontology theirs;
        private final Map<String, OntologyEntity> theirEntities;
        private final Map<String, OntologyRelationship> theirRelationships;
        private final Map<String, BusinessRule> theirRules;

        MergeState(Ontology ours, Ontology theirs) {
            this.entities = IdentityKeyedComparator.index(ours.entities(), OntologyEntity::name);
            this.relationships = IdentityKeyedComparator.index(ours.relationships(), OntologyRelationship::key);
            this.rules = IdentityKeyedComparator.index(ours.businessRules(), BusinessRule::name);

            this.theirs = theirs;
            this.theirEntities = IdentityKeyedComparator.index(theirs.entities(), OntologyEntity::name);
            this.theirRelationships = IdentityKeyedComparator.index(theirs.relationships(), OntologyRelationship::key);
            this.theirRules = IdentityKeyedComparator.index(theirs.businessRules(), BusinessRule::name);
        }

        /**
         * Copies an addition made only by "theirs" into the merged collections.
         */
        void incorporate(Change change) {
            String name = change.elementName();
            switch (change.elementType()) {
                case ENTITY -> entities.put(name, theirEntities.get(name));
                case PROPERTY -> replaceProperty(change.parentName(), name, theirProperty(change.parentName(), name));
                case RELATIONSHIP -> relationships.put(name, theirRelationships.get(name));
                case RULE -> rules.put(name, theirRules.get(name));
                case METADATA -> {
                    // metadata is unioned after the structural pass
                }
            }
        }

        void resolve(Change change, MergeStrategy strategy) {
            switch (strategy) {
                case OURS -> {
                    // merged collections already hold our value
                }
                case THEIRS -> takeTheirs(change);
                case UNION -> unite(change);
            }
        }

        private void takeTheirs(Change change) {
            String name = change.elementName();
            String field = fieldOf(change);
            switch (change.elementType()) {
                case ENTITY -> {
                    OntologyEntity their = theirEntities.get(name);
                    if (field == null) {
                        replace(entities, name, their);
                    } else if (entities.containsKey(name) && their != null) {
                        OntologyEntity current = entities.get(name);
                        entities.put(name, "entity_type".equals(field)
                            ? current.withEntityType(their.entityType())
                            : current.withDescription(their.description()));
                    }
                }
                case PROPERTY -> {
                    String entityName = change.parentName();
                    OntologyProperty their = theirProperty(entityName, name);
                    OntologyProperty current = mergedProperty(entityName, name);
                    if (field == null || current == null || their == null) {
                        replaceProperty(entityName, name, their);
                    } else {
                        replaceProperty(entityName, name, new OntologyProperty(
                            current.name(),
                            "data_type".equals(field) ? their.dataType() : current.dataType(),
                            "required".equals(field) ? their.required() : current.required(),
                            "unique".equals(field) ? their.unique() : current.unique(),
                            current.description(), current.constraints()));
                    }
                }
                case RELATIONSHIP -> {
                    OntologyRelationship their = theirRelationships.get(name);
                    if (field == null || !relationships.containsKey(name) || their == null) {
                        replace(relationships, name, their);
                    } else {
                        OntologyRelationship current = relationships.get(name);
                        relationships.put(name, new OntologyRelationship(
                            current.fromEntity(), current.toEntity(),
                            current.fromProperty(), current.toProperty(),
                            "type".equals(field) ? their.relationshipType() : current.relationshipType(),
                            "cardinality".equals(field) ? their.cardinality() : current.cardinality(),
                            current.description()));
                    }
                }
                case RULE -> {
                    BusinessRule their = theirRules.get(name);
                    if (field == null || !rules.containsKey(name) || their == null) {
                        replace(rules, name, their);
                    } else {
                        BusinessRule current = rules.get(name);
                        rules.put(name, new BusinessRule(
                            current.name(), current.entity(),
                            "condition".equals(field) ? their.condition() : current.condition(),
                            "action".equals(field) ? their.action() : current.action(),
                            "classification".equals(field) ? their.classification() : current.classification(),
                            current.description(), current.priority()));
                    }
                }
                case METADATA -> metadataOverrides.put(name, theirs.metadata().get(name));
            }
        }

        private void unite(Change change) {
            if (change.elementType() != ElementType.ENTITY || change.changeType() != ChangeType.ADDED) {
                // scalar values cannot be combined, ours stays
                return;
            }
            String name = change.elementName();
            OntologyEntity current = entities.get(name);
            OntologyEntity their = theirEntities.get(name);
            if (current == null || their == null) {
                return;
            }
            Map<String, OntologyProperty> properties =
                IdentityKeyedComparator.index(current.properties(), OntologyProperty::name);
            for (OntologyProperty property : their.properties()) {
                properties.putIfAbsent(property.name(), property);
            }
            entities.put(name, current.withProperties(new ArrayList<>(properties.values())));
        }

        private OntologyProperty mergedProperty(String entityName, String propertyName) {
            OntologyEntity current = entities.get(entityName);
            if (current == null) {
                return null;
            }
            return IdentityKeyedComparator.index(current.properties(), OntologyProperty::name).get(propertyName);
        }

        private OntologyProperty theirProperty(String entityName, String propertyName) {
            OntologyEntity their = theirEntities.get(entityName);
            if (their == null) {
                return null;
            }
            return IdentityKeyedComparator.index(their.properties(), OntologyProperty::name).get(propertyName);
        }

        /**
         * Puts or removes a property of a merged entity. Entities we removed are left alone.
         */
        private void replaceProperty(String entityName, String propertyName, OntologyProperty property) {
            OntologyEntity current = entities.get(entityName);
            if (current == null) {
                log.debug("Skipping property {}.{}: entity not in merged model", entityName, propertyName);
                return;
            }
            Map<String, OntologyProperty> properties =
                IdentityKeyedComparator.index(current.properties(), OntologyProperty::name);
            replace(properties, propertyName, property);
            entities.put(entityName, current.withProperties(new ArrayList<>(properties.values())));
        }

        private static <T> void replace(Map<String, T> items, String key, T item) {
            if (item == null) {
                items.remove(key);
            } else {
                items.put(key, item);
            }
        }

        /**
         * Field name of a field-level change, null when the change covers the whole element.
         */
        private static String fieldOf(Change change) {
            String prefix = switch (change.elementType()) {
                case ENTITY, RELATIONSHIP -> change.elementName();
                case PROPERTY -> change.parentName() + "." + change.elementName();
                case RULE -> StructuralDiffEngine.RULE_PREFIX + change.elementName();
                case METADATA -> null;
            };
            if (prefix == null || change.path().length() <= prefix.length()) {
                return null;
            }
            return change.path().substring(prefix.length() + 1);
        }
    }
}
