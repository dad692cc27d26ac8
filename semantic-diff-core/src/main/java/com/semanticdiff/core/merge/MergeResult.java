package com.semanticdiff.core.merge;

import com.semanticdiff.core.model.Ontology;

import java.util.List;
import java.util.Objects;

/**
 * Merged model plus the conflicts found while merging.
 *
 * @param merged merged ontology
 * @param conflicts conflicting paths, in the order their change appears in the base-to-theirs diff
 * @param strategy strategy the merge ran with
 */
public record MergeResult(
    Ontology merged,
    List<MergeConflict> conflicts,
    MergeStrategy strategy
) {
    /**
     * Compact constructor with validation.
     */
    public MergeResult {
        Objects.requireNonNull(merged, "merged must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    /**
     * Checks whether any path conflicted.
     *
     * @return true if conflicts exist
     */
    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
