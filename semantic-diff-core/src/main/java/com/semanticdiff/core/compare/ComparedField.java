package com.semanticdiff.core.compare;

import java.util.Objects;
import java.util.function.Function;

/**
 * A named scalar field that {@link IdentityKeyedComparator} compares on items
 * present on both sides.
 *
 * @param name field name used in the reported path (e.g. "data_type")
 * @param extractor reads the field value from an item
 * @param <T> item type
 */
public record ComparedField<T>(
    String name,
    Function<T, ?> extractor
) {
    /**
     * Compact constructor with validation.
     */
    public ComparedField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Creates a compared field.
     *
     * @param name field name
     * @param extractor value extractor
     * @param <T> item type
     * @return new field
     */
    public static <T> ComparedField<T> of(String name, Function<T, ?> extractor) {
        return new ComparedField<>(name, extractor);
    }

    Object valueOf(T item) {
        return extractor.apply(item);
    }
}
