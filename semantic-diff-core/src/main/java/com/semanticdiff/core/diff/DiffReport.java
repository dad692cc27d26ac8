package com.semanticdiff.core.diff;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of changes between a source and a target model.
 *
 * <p>Changes are grouped per element kind in the order entities (with their
 * properties), relationships, business rules, metadata; within a group
 * additions come before removals, and removals before modifications.
 *
 * @param sourceName source model name
 * @param sourceVersion source model version
 * @param targetName target model name
 * @param targetVersion target model version
 * @param changes ordered changes
 */
public record DiffReport(
    String sourceName,
    String sourceVersion,
    String targetName,
    String targetVersion,
    List<Change> changes
) {
    /**
     * Compact constructor with validation.
     */
    public DiffReport {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    /**
     * Checks whether any change was detected.
     *
     * @return true if the change list is non-empty
     */
    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    /**
     * Counts the changes by change type and element type.
     *
     * @return summary
     */
    public DiffSummary summary() {
        return DiffSummary.of(changes);
    }

    /**
     * Changes of one change type, in report order.
     *
     * @param changeType change type
     * @return matching changes
     */
    public List<Change> changesOf(ChangeType changeType) {
        return changes.stream()
            .filter(change -> change.changeType() == changeType)
            .toList();
    }

    /**
     * Changes of one element type, in report order.
     *
     * @param elementType element type
     * @return matching changes
     */
    public List<Change> changesOf(ElementType elementType) {
        return changes.stream()
            .filter(change -> change.elementType() == elementType)
            .toList();
    }
}
