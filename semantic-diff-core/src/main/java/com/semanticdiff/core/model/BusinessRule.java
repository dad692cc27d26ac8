package com.semanticdiff.core.model;

import java.util.Objects;

/**
 * A business rule bound to an entity.
 *
 * @param name rule name, unique within its ontology
 * @param entity name of the entity the rule applies to
 * @param condition free-text condition expression
 * @param action action taken when the condition holds
 * @param classification classification tag (e.g. "high_value")
 * @param description optional description
 * @param priority rule priority (higher runs first)
 */
public record BusinessRule(
    String name,
    String entity,
    String condition,
    String action,
    String classification,
    String description,
    int priority
) {
    /**
     * Compact constructor with validation.
     */
    public BusinessRule {
        Objects.requireNonNull(name, "name must not be null");
        if (entity == null) {
            entity = "";
        }
        if (condition == null) {
            condition = "";
        }
        if (action == null) {
            action = "";
        }
        if (classification == null) {
            classification = "";
        }
        if (description == null) {
            description = "";
        }
    }
}
