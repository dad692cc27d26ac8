package com.semanticdiff.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A typed property of an {@link OntologyEntity}.
 *
 * @param name property name, unique within its entity
 * @param dataType data type tag (e.g. "String", "Integer", "Decimal")
 * @param required whether a value is mandatory
 * @param unique whether values must be unique
 * @param description optional description
 * @param constraints constraints on the property value
 */
public record OntologyProperty(
    String name,
    String dataType,
    boolean required,
    boolean unique,
    String description,
    List<Constraint> constraints
) {
    /**
     * Compact constructor with validation.
     */
    public OntologyProperty {
        Objects.requireNonNull(name, "name must not be null");
        if (dataType == null) {
            dataType = "String";
        }
        if (description == null) {
            description = "";
        }
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    /**
     * Creates an optional, non-unique property without description or constraints.
     *
     * @param name property name
     * @param dataType data type tag
     * @return new property
     */
    public static OntologyProperty of(String name, String dataType) {
        return new OntologyProperty(name, dataType, false, false, "", List.of());
    }

    /**
     * Creates a required, non-unique property without description or constraints.
     *
     * @param name property name
     * @param dataType data type tag
     * @return new property
     */
    public static OntologyProperty required(String name, String dataType) {
        return new OntologyProperty(name, dataType, true, false, "", List.of());
    }
}
