package com.semanticdiff.core.debt;

/**
 * Kind of cross-model conflict.
 */
public enum ConflictKind {
    /** Same entity name, different property sets */
    ENTITY_STRUCTURE("entity_conflict"),

    /** Same entity property, different data types */
    PROPERTY_TYPE("type_conflict"),

    /** Same entity pair, different cardinalities */
    RELATIONSHIP("relationship_conflict"),

    /** Same rule name, different conditions */
    BUSINESS_RULE("rule_conflict");

    private final String label;

    ConflictKind(String label) {
        this.label = label;
    }

    /**
     * Label used in reports.
     *
     * @return label
     */
    public String label() {
        return label;
    }
}
