package org.oldskooler.computedhash.operations.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(callSuper = true)
public class AddColumnOperation extends ColumnOperation {
    /** Rendered as an IDENTITY column; only meaningful inside a create table. */
    private boolean identity;

    public AddColumnOperation(String table, String name) {
        super(table, name);
    }
}
