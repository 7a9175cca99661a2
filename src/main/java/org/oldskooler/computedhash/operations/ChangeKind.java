package org.oldskooler.computedhash.operations;

/** Coarse kind of the host operation being resolved. */
public enum ChangeKind {
    ADD,
    ALTER,
    DROP
}
