package com.semanticdiff.core.model;

import java.util.Objects;

/**
 * Directed relationship between two entities.
 *
 * <p>Relationships are matched across models by their {@link #key()}, the
 * {@code from → to} entity pair. Two relationships of one model that share the
 * same pair collapse to one during comparison.
 *
 * @param fromEntity source entity name
 * @param toEntity target entity name
 * @param fromProperty join property on the source side
 * @param toProperty join property on the target side
 * @param relationshipType relationship type tag (e.g. "has", "belongs_to")
 * @param cardinality cardinality tag (e.g. "one-to-many")
 * @param description optional description
 */
public record OntologyRelationship(
    String fromEntity,
    String toEntity,
    String fromProperty,
    String toProperty,
    String relationshipType,
    String cardinality,
    String description
) {
    /** Separator used to render the identity key. */
    public static final String KEY_SEPARATOR = "→";

    /**
     * Compact constructor with validation.
     */
    public OntologyRelationship {
        Objects.requireNonNull(fromEntity, "fromEntity must not be null");
        Objects.requireNonNull(toEntity, "toEntity must not be null");
        if (fromProperty == null) {
            fromProperty = "";
        }
        if (toProperty == null) {
            toProperty = "";
        }
        if (relationshipType == null) {
            relationshipType = "related_to";
        }
        if (cardinality == null) {
            cardinality = "one-to-many";
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Identity key of this relationship, rendered as {@code "From→To"}.
     *
     * @return identity key
     */
    public String key() {
        return fromEntity + KEY_SEPARATOR + toEntity;
    }
}
