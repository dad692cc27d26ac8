package com.semanticdiff.core.debt;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a cross-model conflict analysis.
 *
 * @param modelsAnalyzed names of the analyzed models, in input order
 * @param conflicts detected conflicts
 * @param recommendations overall recommendations
 */
public record SemanticDebtReport(
    List<String> modelsAnalyzed,
    List<SemanticConflict> conflicts,
    List<String> recommendations
) {
    /**
     * Compact constructor with validation.
     */
    public SemanticDebtReport {
        modelsAnalyzed = modelsAnalyzed == null ? List.of() : List.copyOf(modelsAnalyzed);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Checks whether any conflict was found.
     *
     * @return true if conflicts exist
     */
    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Conflict count per severity; every severity is present.
     *
     * @return counts by severity
     */
    public Map<ConflictSeverity, Integer> countBySeverity() {
        Map<ConflictSeverity, Integer> counts = new EnumMap<>(ConflictSeverity.class);
        for (ConflictSeverity severity : ConflictSeverity.values()) {
            counts.put(severity, 0);
        }
        conflicts.forEach(conflict -> counts.merge(conflict.severity(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }

    /**
     * Conflict count per kind; only kinds with conflicts are present.
     *
     * @return counts by kind
     */
    public Map<ConflictKind, Integer> countByKind() {
        Map<ConflictKind, Integer> counts = new EnumMap<>(ConflictKind.class);
        conflicts.forEach(conflict -> counts.merge(conflict.kind(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }

    /**
     * Number of conflicts with the given severity.
     *
     * @param severity severity
     * @return count
     */
    public int count(ConflictSeverity severity) {
        return (int) conflicts.stream().filter(conflict -> conflict.severity() == severity).count();
    }

    /**
     * Conflicts with the given severity, in report order.
     *
     * @param severity severity
     * @return matching conflicts
     */
    public List<SemanticConflict> conflictsOf(ConflictSeverity severity) {
        return conflicts.stream()
            .filter(conflict -> conflict.severity() == severity)
            .toList();
    }

    /**
     * Conflicts of the given kind, in report order.
     *
     * @param kind conflict kind
     * @return matching conflicts
     */
    public List<SemanticConflict> conflictsOf(ConflictKind kind) {
        return conflicts.stream()
            .filter(conflict -> conflict.kind() == kind)
            .toList();
    }
}
