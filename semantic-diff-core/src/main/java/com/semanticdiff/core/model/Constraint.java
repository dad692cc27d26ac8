package com.semanticdiff.core.model;

import java.util.Objects;

/**
 * A validation constraint attached to an entity or property.
 *
 * <p>Constraints are never diffed on their own; they only take part in the
 * equality of the record that owns them.
 *
 * @param type constraint type tag (e.g. "range", "regex", "enum")
 * @param value constraint value as text
 * @param message optional message shown when the constraint is violated
 */
public record Constraint(
    String type,
    String value,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Constraint {
        Objects.requireNonNull(type, "type must not be null");
        if (value == null) {
            value = "";
        }
        if (message == null) {
            message = "";
        }
    }
}
