package com.semanticdiff.core.debt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A definition that disagrees across independently authored models.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SemanticConflict conflict = new SemanticConflict(
 *     ConflictKind.PROPERTY_TYPE,
 *     ConflictSeverity.CRITICAL,
 *     "Customer.CustomerId",
 *     List.of("Sales", "Finance"),
 *     Map.of("Sales", "Type: Integer", "Finance", "Type: String"),
 *     "Property 'Customer.CustomerId' has different types: Integer, String",
 *     "Standardize the data type for 'CustomerId' across all models."
 * );
 * }</pre>
 *
 * @param kind conflict kind
 * @param severity risk level
 * @param name name of the conflicting element
 * @param sources names of the models involved
 * @param details per-source description of the element
 * @param description human-readable description
 * @param recommendation suggested remediation
 */
public record SemanticConflict(
    ConflictKind kind,
    ConflictSeverity severity,
    String name,
    List<String> sources,
    Map<String, String> details,
    String description,
    String recommendation
) {
    /**
     * Compact constructor with validation.
     */
    public SemanticConflict {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(name, "name must not be null");
        sources = sources == null ? List.of() : List.copyOf(sources);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        if (description == null) {
            description = "";
        }
        if (recommendation == null) {
            recommendation = "";
        }
    }
}
