package com.semanticdiff.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Represents an entity (table, dimension, fact, ...) of an ontology.
 *
 * @param name entity name, unique within its ontology
 * @param description optional description
 * @param entityType entity type tag (e.g. "dimension", "fact", "standard")
 * @param properties properties of the entity
 * @param constraints entity-level constraints
 */
public record OntologyEntity(
    String name,
    String description,
    String entityType,
    List<OntologyProperty> properties,
    List<Constraint> constraints
) {
    /**
     * Compact constructor with validation.
     */
    public OntologyEntity {
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) {
            description = "";
        }
        if (entityType == null) {
            entityType = "standard";
        }
        properties = properties == null ? List.of() : List.copyOf(properties);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    /**
     * Returns a copy of this entity with a different property list.
     *
     * @param newProperties replacement properties
     * @return new entity
     */
    public OntologyEntity withProperties(List<OntologyProperty> newProperties) {
        return new OntologyEntity(name, description, entityType, newProperties, constraints);
    }

    /**
     * Returns a copy of this entity with a different description.
     *
     * @param newDescription replacement description
     * @return new entity
     */
    public OntologyEntity withDescription(String newDescription) {
        return new OntologyEntity(name, newDescription, entityType, properties, constraints);
    }

    /**
     * Returns a copy of this entity with a different entity type.
     *
     * @param newEntityType replacement type tag
     * @return new entity
     */
    public OntologyEntity withEntityType(String newEntityType) {
        return new OntologyEntity(name, description, newEntityType, properties, constraints);
    }
}
