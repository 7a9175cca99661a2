package org.oldskooler.computedhash.error;

/**
 * The rule a computed hash declaration broke.
 */
public enum Violation {
    UNKNOWN_ALGORITHM("unknown or unsupported hash algorithm"),
    EMPTY_SOURCE_LIST("at least one source property is required"),
    DUPLICATE_SOURCE("source properties must not repeat"),
    INVALID_SOURCE("source properties must name other, non-computed columns of the same entity"),
    INVALID_TARGET_TYPE("computed hash columns must be of type byte[]"),
    INCOMPATIBLE_STORAGE_TYPE("computed hash columns must use a BINARY storage type"),
    MALFORMED_ANNOTATION_STATE("computed hash annotations are incomplete or inconsistent");

    private final String rule;

    Violation(String rule) {
        this.rule = rule;
    }

    /** Human readable rule text, used as the message prefix. */
    public String rule() {
        return rule;
    }
}
