package org.oldskooler.computedhash.operations.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A schema change produced by the snapshot differ and rendered to SQL by a dialect.
 */
@Getter
@ToString
public abstract class MigrationOperation {
    private final String table;

    protected MigrationOperation(String table) {
        this.table = Objects.requireNonNull(table, "table");
    }
}
