package org.oldskooler.computedhash.operations;

/**
 * How a column's computed hash definition moves between two model versions.
 */
public enum Transition {
    /** New column defined as a computed hash. */
    CREATE,
    /** Existing ordinary column becomes a computed hash. */
    CONVERT_TO_COMPUTED,
    /** Algorithm, sources or both changed; type and expression re-derived together. */
    ALTER_DEFINITION,
    /** Computed hash column becomes an ordinary, writable column. */
    CONVERT_TO_PLAIN,
    DROP,
    /** Same descriptor on both sides. */
    NO_OP,
    /** Neither side is a computed hash; the operation is none of our business. */
    NOT_TRACKED
}
