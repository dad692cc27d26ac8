package com.semanticdiff.core.compare;

import java.util.Objects;

/**
 * One differing scalar field of an item present in both compared collections.
 *
 * @param key identity key of the item
 * @param field name of the differing field
 * @param oldValue value on the source side, rendered as text (may be null)
 * @param newValue value on the target side, rendered as text (may be null)
 */
public record FieldDifference(
    String key,
    String field,
    String oldValue,
    String newValue
) {
    /**
     * Compact constructor with validation.
     */
    public FieldDifference {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(field, "field must not be null");
    }
}
