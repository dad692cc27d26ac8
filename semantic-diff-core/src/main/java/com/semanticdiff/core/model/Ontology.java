package com.semanticdiff.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root aggregate of a semantic model: entities, relationships, business rules
 * and free-form metadata.
 *
 * <p>This is the single input type of the diff, merge and semantic-debt engines.
 * Instances are immutable; every collection is copied on construction, and the
 * engines always build new instances instead of modifying one.
 *
 * @param name model name
 * @param version version string (e.g. "1.2")
 * @param source label of the source the model was extracted from
 * @param entities entities of the model
 * @param relationships relationships between entities
 * @param businessRules business rules
 * @param metadata string metadata
 */
public record Ontology(
    String name,
    String version,
    String source,
    List<OntologyEntity> entities,
    List<OntologyRelationship> relationships,
    List<BusinessRule> businessRules,
    Map<String, String> metadata
) {
    /**
     * Compact constructor with validation.
     */
    public Ontology {
        Objects.requireNonNull(name, "name must not be null");
        if (version == null) {
            version = "1.0";
        }
        if (source == null) {
            source = "";
        }
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        businessRules = businessRules == null ? List.of() : List.copyOf(businessRules);
        // insertion order is kept so reports list metadata keys as authored
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Looks up an entity by name. When several entities share the name the
     * last one wins, as in every identity-keyed lookup.
     *
     * @param entityName entity name
     * @return the entity, if present
     */
    public Optional<OntologyEntity> findEntity(String entityName) {
        OntologyEntity found = null;
        for (OntologyEntity entity : entities) {
            if (entity.name().equals(entityName)) {
                found = entity;
            }
        }
        return Optional.ofNullable(found);
    }
}
