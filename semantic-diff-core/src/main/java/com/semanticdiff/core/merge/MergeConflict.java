package com.semanticdiff.core.merge;

import com.semanticdiff.core.diff.Change;
import com.semanticdiff.core.diff.ElementType;

import java.util.Objects;

/**
 * A path changed by both sides of a three-way merge.
 *
 * @param path conflicting path
 * @param elementType kind of element at the path
 * @param resolution strategy recorded for the conflict
 * @param ourChange our change at the path
 * @param theirChange their change at the path
 */
public record MergeConflict(
    String path,
    ElementType elementType,
    MergeStrategy resolution,
    Change ourChange,
    Change theirChange
) {
    /**
     * Compact constructor with validation.
     */
    public MergeConflict {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(elementType, "elementType must not be null");
        Objects.requireNonNull(resolution, "resolution must not be null");
    }
}
