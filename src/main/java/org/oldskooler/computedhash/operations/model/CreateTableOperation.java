package org.oldskooler.computedhash.operations.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@ToString(callSuper = true)
public class CreateTableOperation extends MigrationOperation {
    private final List<AddColumnOperation> columns = new ArrayList<>();
    private final List<String> primaryKey = new ArrayList<>();

    public CreateTableOperation(String table) {
        super(table);
    }
}
