package com.semanticdiff.core.diff;

/**
 * Kind of model element a change applies to.
 */
public enum ElementType {
    ENTITY,
    PROPERTY,
    RELATIONSHIP,
    RULE,
    METADATA;

    /**
     * Lower-case label used in reports and synthetic diff lines.
     *
     * @return label
     */
    public String label() {
        return name().toLowerCase();
    }
}
