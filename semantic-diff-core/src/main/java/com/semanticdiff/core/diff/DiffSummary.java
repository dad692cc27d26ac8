package com.semanticdiff.core.diff;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Change counts of a {@link DiffReport}.
 *
 * @param totalChanges number of changes
 * @param added number of additions
 * @param removed number of removals
 * @param modified number of modifications
 * @param byElement change count per element type, only types with changes
 */
public record DiffSummary(
    int totalChanges,
    int added,
    int removed,
    int modified,
    Map<ElementType, Integer> byElement
) {
    /**
     * Compact constructor with validation.
     */
    public DiffSummary {
        Map<ElementType, Integer> copy = new EnumMap<>(ElementType.class);
        if (byElement != null) {
            copy.putAll(byElement);
        }
        byElement = Collections.unmodifiableMap(copy);
    }

    /**
     * Counts the given changes.
     *
     * @param changes changes to summarize
     * @return summary
     */
    public static DiffSummary of(List<Change> changes) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        Map<ElementType, Integer> byElement = new EnumMap<>(ElementType.class);

        for (Change change : changes) {
            switch (change.changeType()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case MODIFIED -> modified++;
            }
            byElement.merge(change.elementType(), 1, Integer::sum);
        }

        return new DiffSummary(changes.size(), added, removed, modified, byElement);
    }

    /**
     * Count for one change type.
     *
     * @param changeType change type
     * @return count
     */
    public int count(ChangeType changeType) {
        return switch (changeType) {
            case ADDED -> added;
            case REMOVED -> removed;
            case MODIFIED -> modified;
        };
    }
}
