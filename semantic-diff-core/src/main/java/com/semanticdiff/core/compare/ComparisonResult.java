package com.semanticdiff.core.compare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of comparing two identity-keyed collections.
 *
 * <p>{@code added} holds the target items whose key is absent from the source,
 * {@code removed} the source items whose key is absent from the target, and
 * {@code common} the keys present on both sides. {@code modified} lists one
 * entry per differing field of a common item.
 *
 * @param added target-only items by key, in target order
 * @param removed source-only items by key, in source order
 * @param common keys present on both sides, in source order
 * @param modified field differences of common items
 * @param <T> item type
 */
public record ComparisonResult<T>(
    Map<String, T> added,
    Map<String, T> removed,
    List<String> common,
    List<FieldDifference> modified
) {
    /**
     * Compact constructor with validation.
     */
    public ComparisonResult {
        Objects.requireNonNull(added, "added must not be null");
        Objects.requireNonNull(removed, "removed must not be null");
        Objects.requireNonNull(common, "common must not be null");
        Objects.requireNonNull(modified, "modified must not be null");

        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        common = List.copyOf(common);
        modified = List.copyOf(modified);
    }

    /**
     * Checks whether the two collections were equal under the compared fields.
     *
     * @return true if nothing was added, removed or modified
     */
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
