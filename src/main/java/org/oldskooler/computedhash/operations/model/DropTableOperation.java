package org.oldskooler.computedhash.operations.model;

import lombok.ToString;

@ToString(callSuper = true)
public class DropTableOperation extends MigrationOperation {
    public DropTableOperation(String table) {
        super(table);
    }
}
